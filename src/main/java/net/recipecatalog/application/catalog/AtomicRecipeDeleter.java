package net.recipecatalog.application.catalog;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import net.recipecatalog.domain.catalog.VersionedDocument;
import net.recipecatalog.exception.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes one recipe key from the catalog and from the embedding index.
 *
 * <p>Each attempt works on both documents in turn with its own conditional write; a
 * conflict on either one restarts the attempt and reloads both. A key that is already
 * absent counts as removed, which makes deletes idempotent. The two writes are not
 * transactional: if the index write fails for good after the catalog write landed,
 * the documents stay diverged.</p>
 */
public class AtomicRecipeDeleter {

    private static final Logger logger = LoggerFactory.getLogger(AtomicRecipeDeleter.class);

    private enum Removal { REMOVED, ALREADY_ABSENT, CONFLICT }

    private final VersionedDocumentStore<RecipeCatalog> catalogStore;
    private final VersionedDocumentStore<EmbeddingIndex> embeddingStore;
    private final ConflictRetryPolicy retryPolicy;

    private final Counter deleteConflicts;
    private final Counter deleteFailures;

    public AtomicRecipeDeleter(VersionedDocumentStore<RecipeCatalog> catalogStore,
                               VersionedDocumentStore<EmbeddingIndex> embeddingStore,
                               ConflictRetryPolicy retryPolicy,
                               MeterRegistry meterRegistry) {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
        this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.deleteConflicts = meterRegistry.counter("recipe.catalog.delete.conflicts");
        this.deleteFailures = meterRegistry.counter("recipe.catalog.delete.failures");
    }

    /**
     * Deletes {@code recipeKey} from both documents.
     *
     * @return success once both documents no longer hold the key; otherwise a failure
     *         naming the document that could not be updated
     */
    public DeleteOutcome delete(String recipeKey) {
        Objects.requireNonNull(recipeKey, "recipeKey");
        int maxAttempts = retryPolicy.maxAttempts();
        String conflictedDocument = catalogStore.documentKey();

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            logger.info("Delete attempt {}/{} for recipe '{}'", attempt + 1, maxAttempts, recipeKey);
            VersionedDocumentStore<?> current = catalogStore;
            try {
                Removal catalogRemoval = removeKey(catalogStore, recipeKey,
                    RecipeCatalog::containsKey, RecipeCatalog::without);
                if (catalogRemoval == Removal.CONFLICT) {
                    conflictedDocument = catalogStore.documentKey();
                    backOff(attempt, recipeKey, conflictedDocument);
                    continue;
                }

                current = embeddingStore;
                Removal indexRemoval = removeKey(embeddingStore, recipeKey,
                    EmbeddingIndex::containsKey, EmbeddingIndex::without);
                if (indexRemoval == Removal.CONFLICT) {
                    conflictedDocument = embeddingStore.documentKey();
                    backOff(attempt, recipeKey, conflictedDocument);
                    continue;
                }

                logger.info("Recipe '{}' deleted (catalog: {}, embeddings: {})",
                    recipeKey, describe(catalogRemoval), describe(indexRemoval));
                return DeleteOutcome.succeeded();
            } catch (DocumentStoreException storeFailure) {
                deleteFailures.increment();
                logger.error("Store failure deleting recipe '{}' from {}: {}",
                    recipeKey, current.documentKey(), storeFailure.getMessage(), storeFailure);
                return DeleteOutcome.failed("Error updating " + current.documentKey() + ": " + storeFailure.getMessage());
            }
        }

        deleteFailures.increment();
        logger.error("Delete of recipe '{}' gave up after {} attempts; last conflict on {}",
            recipeKey, maxAttempts, conflictedDocument);
        return DeleteOutcome.failed("Max retries exceeded updating " + conflictedDocument);
    }

    private <T> Removal removeKey(VersionedDocumentStore<T> store,
                                  String recipeKey,
                                  BiPredicate<T, String> contains,
                                  BiFunction<T, String, T> remove) {
        VersionedDocument<T> snapshot = store.load();
        if (!contains.test(snapshot.document(), recipeKey)) {
            logger.info("Recipe key '{}' not present in {}; nothing to remove", recipeKey, store.documentKey());
            return Removal.ALREADY_ABSENT;
        }
        T updated = remove.apply(snapshot.document(), recipeKey);
        if (store.save(updated, snapshot.version())) {
            return Removal.REMOVED;
        }
        return Removal.CONFLICT;
    }

    private void backOff(int attempt, String recipeKey, String documentKey) {
        deleteConflicts.increment();
        logger.warn("Conditional write conflict on {} while deleting '{}' (attempt {})",
            documentKey, recipeKey, attempt + 1);
        if (retryPolicy.hasAttemptAfter(attempt)) {
            retryPolicy.pauseAfter(attempt);
        }
    }

    private static String describe(Removal removal) {
        return removal == Removal.REMOVED ? "removed" : "already absent";
    }
}
