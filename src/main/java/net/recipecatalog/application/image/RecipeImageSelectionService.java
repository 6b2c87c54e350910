package net.recipecatalog.application.image;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.Optional;
import net.recipecatalog.application.catalog.ConflictRetryPolicy;
import net.recipecatalog.application.catalog.VersionedDocumentStore;
import net.recipecatalog.domain.catalog.Recipe;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import net.recipecatalog.domain.catalog.VersionedDocument;
import net.recipecatalog.exception.RecipeNotFoundException;
import net.recipecatalog.exception.RetryBudgetExhaustedException;
import net.recipecatalog.support.s3.S3ObjectStorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the image a user picked for a recipe and points the catalog entry at it.
 *
 * <p>The image object is written first and the catalog second. If the catalog update
 * does not land, the image object is deleted again so no orphan is left behind.</p>
 */
public class RecipeImageSelectionService {

    private static final Logger logger = LoggerFactory.getLogger(RecipeImageSelectionService.class);

    static final String IMAGE_CONTENT_TYPE = "image/jpeg";
    private static final String IMAGE_SUFFIX = ".jpg";

    private final VersionedDocumentStore<RecipeCatalog> catalogStore;
    private final S3ObjectStorageGateway objectStorage;
    private final ConflictRetryPolicy retryPolicy;
    private final String imagesPrefix;

    private final Counter selectionConflicts;
    private final Counter selectionRollbacks;

    public RecipeImageSelectionService(VersionedDocumentStore<RecipeCatalog> catalogStore,
                                       S3ObjectStorageGateway objectStorage,
                                       ConflictRetryPolicy retryPolicy,
                                       String imagesPrefix,
                                       MeterRegistry meterRegistry) {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
        this.objectStorage = Objects.requireNonNull(objectStorage, "objectStorage");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.imagesPrefix = Objects.requireNonNull(imagesPrefix, "imagesPrefix");
        this.selectionConflicts = meterRegistry.counter("recipe.image.selection.conflicts");
        this.selectionRollbacks = meterRegistry.counter("recipe.image.selection.rollbacks");
    }

    /**
     * Records {@code imageUrl} as the chosen image of {@code recipeKey}.
     *
     * @param imageBytes JPEG bytes stored under {@code images/<key>.jpg}
     * @return the recipe as written
     * @throws IllegalArgumentException if the URL or image bytes are missing
     * @throws RecipeNotFoundException if the catalog has no such key, before or during the update
     * @throws RetryBudgetExhaustedException if every catalog write conflicted
     */
    public Recipe selectImage(String recipeKey, String imageUrl, byte[] imageBytes) {
        Objects.requireNonNull(recipeKey, "recipeKey");
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("imageUrl is required");
        }
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IllegalArgumentException("image file is required");
        }
        if (!catalogStore.load().document().containsKey(recipeKey)) {
            throw new RecipeNotFoundException(recipeKey);
        }

        String imageKey = imageKey(recipeKey);
        objectStorage.putObject(imageKey, imageBytes, IMAGE_CONTENT_TYPE);

        try {
            Recipe updated = updateCatalog(recipeKey, imageUrl);
            logger.info("Recipe '{}' now uses image {} (stored at {})", recipeKey, imageUrl, imageKey);
            return updated;
        } catch (RuntimeException failure) {
            rollBackImage(imageKey, failure);
            throw failure;
        }
    }

    String imageKey(String recipeKey) {
        return imagesPrefix + recipeKey + IMAGE_SUFFIX;
    }

    private Recipe updateCatalog(String recipeKey, String imageUrl) {
        return retryPolicy.execute(catalogStore.documentKey(), attempt -> {
            VersionedDocument<RecipeCatalog> snapshot = catalogStore.load();
            Recipe updated = snapshot.document().find(recipeKey)
                .orElseThrow(() -> new RecipeNotFoundException(recipeKey))
                .withSelectedImage(imageUrl);
            if (catalogStore.save(snapshot.document().with(recipeKey, updated), snapshot.version())) {
                return Optional.of(updated);
            }
            return Optional.empty();
        }, attempt -> {
            selectionConflicts.increment();
            logger.warn("Conditional write conflict setting image for '{}' (attempt {}/{})",
                recipeKey, attempt + 1, retryPolicy.maxAttempts());
        });
    }

    private void rollBackImage(String imageKey, RuntimeException cause) {
        selectionRollbacks.increment();
        logger.warn("Catalog update failed ({}); deleting image object {}", cause.getMessage(), imageKey);
        try {
            objectStorage.deleteObject(imageKey);
        } catch (RuntimeException rollbackFailure) {
            logger.error("Rollback of image object {} failed: {}", imageKey, rollbackFailure.getMessage(), rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }
}
