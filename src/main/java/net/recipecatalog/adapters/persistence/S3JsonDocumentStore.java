package net.recipecatalog.adapters.persistence;

import jakarta.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import net.recipecatalog.application.catalog.VersionedDocumentStore;
import net.recipecatalog.domain.catalog.VersionedDocument;
import net.recipecatalog.exception.DocumentStoreException;
import net.recipecatalog.support.s3.S3ObjectStorageGateway;
import net.recipecatalog.support.s3.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;

/**
 * S3 adapter for one JSON document guarded by its ETag.
 *
 * <p>Owns the JSON codec for the document so the writers stay storage-agnostic. A body
 * that cannot be decoded is a store failure, never an empty document: treating it as
 * empty would let the next write wipe the catalog.</p>
 *
 * @param <T> document type
 */
public class S3JsonDocumentStore<T> implements VersionedDocumentStore<T> {

    private static final Logger log = LoggerFactory.getLogger(S3JsonDocumentStore.class);

    private final S3ObjectStorageGateway gateway;
    private final String documentKey;
    private final JsonDocumentCodec<T> codec;

    public S3JsonDocumentStore(S3ObjectStorageGateway gateway, String documentKey, JsonDocumentCodec<T> codec) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.documentKey = Objects.requireNonNull(documentKey, "documentKey");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public VersionedDocument<T> load() {
        Optional<StoredObject> stored = gateway.fetchUtf8Object(documentKey);
        if (stored.isEmpty()) {
            log.info("Document {} does not exist yet; starting from an empty document", documentKey);
            return VersionedDocument.absent(codec.empty());
        }
        StoredObject object = stored.get();
        return new VersionedDocument<>(decode(object.body()), object.eTag());
    }

    @Override
    public boolean save(T document, @Nullable String expectedVersion) {
        String json;
        try {
            json = codec.encode(document);
        } catch (JacksonException exception) {
            throw new DocumentStoreException(documentKey,
                "Failed to serialize " + documentKey + ": " + exception.getMessage(), exception);
        }
        return gateway.putJsonConditionally(documentKey, json, expectedVersion);
    }

    @Override
    public String documentKey() {
        return documentKey;
    }

    private T decode(String body) {
        try {
            return codec.decode(body);
        } catch (JacksonException exception) {
            throw new DocumentStoreException(documentKey,
                "Corrupt JSON in " + documentKey + ": " + exception.getMessage(), exception);
        } catch (IllegalArgumentException exception) {
            throw new DocumentStoreException(documentKey,
                "Unexpected document shape in " + documentKey + ": " + exception.getMessage(), exception);
        }
    }
}
