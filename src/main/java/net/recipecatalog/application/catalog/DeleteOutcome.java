package net.recipecatalog.application.catalog;

import jakarta.annotation.Nullable;

/**
 * Result of removing one recipe key from the catalog and the embedding index.
 *
 * @param success both documents confirmed the key is gone
 * @param error reason naming the failing document, {@code null} on success
 */
public record DeleteOutcome(boolean success, @Nullable String error) {

    private static final DeleteOutcome SUCCESS = new DeleteOutcome(true, null);

    public static DeleteOutcome succeeded() {
        return SUCCESS;
    }

    public static DeleteOutcome failed(String error) {
        return new DeleteOutcome(false, error);
    }
}
