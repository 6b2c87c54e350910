package net.recipecatalog.exception;

/**
 * Object store failure other than a version conflict (auth, network, corrupt body, etc.).
 * RETRYABLE: No (propagated immediately to the caller)
 */
public class DocumentStoreException extends RuntimeException {

    private final String documentKey;

    public DocumentStoreException(String documentKey, String message, Throwable cause) {
        super(message, cause);
        this.documentKey = documentKey;
    }

    public DocumentStoreException(String documentKey, String message) {
        this(documentKey, message, null);
    }

    /** Object key of the document the failed operation targeted. */
    public String getDocumentKey() {
        return documentKey;
    }
}
