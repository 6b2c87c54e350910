package net.recipecatalog.exception;

/**
 * Every conditional write attempt against a document lost its race.
 * Nothing was committed for that document by the failing call.
 */
public class RetryBudgetExhaustedException extends RuntimeException {

    private final String documentKey;
    private final int attempts;

    public RetryBudgetExhaustedException(String documentKey, int attempts) {
        super("Race condition: max retries exceeded after " + attempts + " attempts on " + documentKey);
        this.documentKey = documentKey;
        this.attempts = attempts;
    }

    public String getDocumentKey() {
        return documentKey;
    }

    public int getAttempts() {
        return attempts;
    }
}
