package net.recipecatalog.application.catalog;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.domain.catalog.VersionedDocument;
import net.recipecatalog.exception.RetryBudgetExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges new vectors into the embedding index under optimistic concurrency.
 *
 * <p>The index is only ever extended from a fresh reload, never replaced from a copy
 * held across attempts.</p>
 */
public class EmbeddingIndexWriter {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingIndexWriter.class);

    private final VersionedDocumentStore<EmbeddingIndex> embeddingStore;
    private final ConflictRetryPolicy retryPolicy;
    private final Counter mergeConflicts;

    public EmbeddingIndexWriter(VersionedDocumentStore<EmbeddingIndex> embeddingStore,
                                ConflictRetryPolicy retryPolicy,
                                MeterRegistry meterRegistry) {
        this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.mergeConflicts = meterRegistry.counter("recipe.embeddings.merge.conflicts");
    }

    /**
     * Adds (or replaces) {@code entries} in the stored index.
     *
     * @return the index as written; the loaded index when {@code entries} is empty
     * @throws RetryBudgetExhaustedException if every attempt lost its conditional write
     */
    public EmbeddingIndex merge(Map<String, double[]> entries) {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) {
            return embeddingStore.load().document();
        }
        String documentKey = embeddingStore.documentKey();
        return retryPolicy.execute(documentKey, attempt -> {
            VersionedDocument<EmbeddingIndex> snapshot = embeddingStore.load();
            EmbeddingIndex merged = snapshot.document().withAll(entries);
            if (!embeddingStore.save(merged, snapshot.version())) {
                return Optional.empty();
            }
            logger.info("Merged {} embedding(s) {} into {} (now {} entries)",
                entries.size(), entries.keySet(), documentKey, merged.size());
            return Optional.of(merged);
        }, attempt -> {
            mergeConflicts.increment();
            logger.warn("Conditional write conflict merging embeddings into {} (attempt {}/{})",
                documentKey, attempt + 1, retryPolicy.maxAttempts());
        });
    }

    /**
     * Current stored index, for duplicate screening during a batch write.
     */
    public EmbeddingIndex currentIndex() {
        return embeddingStore.load().document();
    }
}
