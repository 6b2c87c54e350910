package net.recipecatalog.application.catalog;

import jakarta.annotation.Nullable;
import net.recipecatalog.domain.catalog.VersionedDocument;

/**
 * One JSON document in an object store that only offers single-object compare-and-swap.
 *
 * <p>Implementations never retry; conflict handling belongs to the callers.</p>
 *
 * @param <T> decoded document type
 */
public interface VersionedDocumentStore<T> {

    /**
     * Reads the document and the version it was read at.
     *
     * @return the empty document with a {@code null} version when the object does not exist
     * @throws net.recipecatalog.exception.DocumentStoreException on any other failure
     */
    VersionedDocument<T> load();

    /**
     * Replaces the whole document if its current version still equals {@code expectedVersion}.
     *
     * @param expectedVersion version from the matching {@link #load()}, or {@code null} to create
     *                        the document only if it does not exist yet
     * @return {@code true} when written, {@code false} when another writer got there first
     * @throws net.recipecatalog.exception.DocumentStoreException on any failure other than a conflict
     */
    boolean save(T document, @Nullable String expectedVersion);

    /**
     * Object key of the backing document, used in logs and error messages.
     */
    String documentKey();
}
