package net.recipecatalog.domain.catalog;

import jakarta.annotation.Nullable;
import java.util.Objects;

/**
 * A document body paired with the store version it was read at.
 *
 * @param document decoded body; the empty value when the object does not exist yet
 * @param version opaque version token (ETag), or {@code null} when the object does not exist yet
 * @param <T> document type
 */
public record VersionedDocument<T>(T document, @Nullable String version) {

    public VersionedDocument {
        Objects.requireNonNull(document, "document");
    }

    public static <T> VersionedDocument<T> absent(T emptyDocument) {
        return new VersionedDocument<>(emptyDocument, null);
    }

    /**
     * {@code false} means the next save is a first-write bootstrap.
     */
    public boolean exists() {
        return version != null;
    }
}
