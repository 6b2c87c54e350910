package net.recipecatalog.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import net.recipecatalog.adapters.persistence.EmbeddingIndexCodec;
import net.recipecatalog.adapters.persistence.RecipeCatalogCodec;
import net.recipecatalog.adapters.persistence.S3JsonDocumentStore;
import net.recipecatalog.adapters.persistence.UploadStatusRepository;
import net.recipecatalog.application.catalog.AtomicRecipeDeleter;
import net.recipecatalog.application.catalog.BatchCatalogWriter;
import net.recipecatalog.application.catalog.ConflictRetryPolicy;
import net.recipecatalog.application.catalog.EmbeddingIndexWriter;
import net.recipecatalog.application.catalog.VersionedDocumentStore;
import net.recipecatalog.application.image.RecipeImageSelectionService;
import net.recipecatalog.application.upload.RecipeUploadService;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import net.recipecatalog.support.s3.S3ObjectStorageGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;
import tools.jackson.databind.ObjectMapper;

/**
 * Wires the catalog documents and the services that write them.
 *
 * <p>These beans exist even when S3 is not configured; the gateway then rejects every
 * operation with a store failure instead of the application refusing to start.</p>
 */
@Configuration
public class CatalogStoreConfig {

    @Bean
    public S3ObjectStorageGateway s3ObjectStorageGateway(ObjectProvider<S3Client> s3Client,
                                                         @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName) {
        S3ObjectStorageGateway gateway = new S3ObjectStorageGateway(s3Client.getIfAvailable(), bucketName);
        gateway.validateConfiguration();
        return gateway;
    }

    @Bean
    public Clock catalogClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConflictRetryPolicy conflictRetryPolicy(CatalogProperties properties) {
        return new ConflictRetryPolicy(properties.getMaxAttempts(), properties.getBackoffMin(), properties.getBackoffMax());
    }

    @Bean
    public VersionedDocumentStore<RecipeCatalog> recipeCatalogStore(S3ObjectStorageGateway gateway,
                                                                    ObjectMapper objectMapper,
                                                                    CatalogProperties properties) {
        return new S3JsonDocumentStore<>(gateway, properties.getCatalogKey(), new RecipeCatalogCodec(objectMapper));
    }

    @Bean
    public VersionedDocumentStore<EmbeddingIndex> embeddingIndexStore(S3ObjectStorageGateway gateway,
                                                                      ObjectMapper objectMapper,
                                                                      CatalogProperties properties) {
        return new S3JsonDocumentStore<>(gateway, properties.getEmbeddingsKey(), new EmbeddingIndexCodec(objectMapper));
    }

    @Bean
    public UploadStatusRepository uploadStatusRepository(S3ObjectStorageGateway gateway,
                                                         ObjectMapper objectMapper,
                                                         CatalogProperties properties) {
        return new UploadStatusRepository(gateway, objectMapper, properties.getUploadStatusPrefix());
    }

    @Bean
    public BatchCatalogWriter batchCatalogWriter(VersionedDocumentStore<RecipeCatalog> recipeCatalogStore,
                                                 ConflictRetryPolicy conflictRetryPolicy,
                                                 Clock catalogClock,
                                                 MeterRegistry meterRegistry) {
        return new BatchCatalogWriter(recipeCatalogStore, conflictRetryPolicy, catalogClock, meterRegistry);
    }

    @Bean
    public EmbeddingIndexWriter embeddingIndexWriter(VersionedDocumentStore<EmbeddingIndex> embeddingIndexStore,
                                                     ConflictRetryPolicy conflictRetryPolicy,
                                                     MeterRegistry meterRegistry) {
        return new EmbeddingIndexWriter(embeddingIndexStore, conflictRetryPolicy, meterRegistry);
    }

    @Bean
    public AtomicRecipeDeleter atomicRecipeDeleter(VersionedDocumentStore<RecipeCatalog> recipeCatalogStore,
                                                   VersionedDocumentStore<EmbeddingIndex> embeddingIndexStore,
                                                   ConflictRetryPolicy conflictRetryPolicy,
                                                   MeterRegistry meterRegistry) {
        return new AtomicRecipeDeleter(recipeCatalogStore, embeddingIndexStore, conflictRetryPolicy, meterRegistry);
    }

    @Bean
    public RecipeUploadService recipeUploadService(BatchCatalogWriter batchCatalogWriter,
                                                   EmbeddingIndexWriter embeddingIndexWriter,
                                                   UploadStatusRepository uploadStatusRepository,
                                                   CatalogProperties properties,
                                                   Clock catalogClock) {
        return new RecipeUploadService(batchCatalogWriter, embeddingIndexWriter, uploadStatusRepository,
            properties.getSimilarityThreshold(), catalogClock);
    }

    @Bean
    public RecipeImageSelectionService recipeImageSelectionService(VersionedDocumentStore<RecipeCatalog> recipeCatalogStore,
                                                                   S3ObjectStorageGateway gateway,
                                                                   ConflictRetryPolicy conflictRetryPolicy,
                                                                   CatalogProperties properties,
                                                                   MeterRegistry meterRegistry) {
        return new RecipeImageSelectionService(recipeCatalogStore, gateway, conflictRetryPolicy,
            properties.getImagesPrefix(), meterRegistry);
    }
}
