package net.recipecatalog.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the recipe catalog documents and their writers.
 */
@Component
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /**
     * Object key of the catalog document.
     */
    private String catalogKey = "jsondata/combined_data.json";

    /**
     * Object key of the embedding index document.
     */
    private String embeddingsKey = "jsondata/recipe_embeddings.json";

    /**
     * Prefix for per-job upload status documents.
     */
    private String uploadStatusPrefix = "upload-status/";

    /**
     * Prefix for selected recipe images.
     */
    private String imagesPrefix = "images/";

    /**
     * Cosine similarity strictly above which a recipe counts as a duplicate.
     */
    private double similarityThreshold = 0.85;

    /**
     * Attempts per conditional-write loop, first attempt included.
     */
    private int maxAttempts = 3;

    private Duration backoffMin = Duration.ofMillis(100);

    private Duration backoffMax = Duration.ofMillis(500);

    @PostConstruct
    void validate() {
        Assert.hasText(catalogKey, "catalog.catalog-key must not be blank");
        Assert.hasText(embeddingsKey, "catalog.embeddings-key must not be blank");
        Assert.isTrue(!catalogKey.equals(embeddingsKey), "catalog and embeddings keys must differ");
        Assert.isTrue(similarityThreshold >= -1.0 && similarityThreshold <= 1.0,
            "catalog.similarity-threshold must be within [-1, 1]");
        Assert.isTrue(maxAttempts >= 1, "catalog.max-attempts must be at least 1");
        Assert.isTrue(!backoffMin.isNegative() && !backoffMin.isZero(), "catalog.backoff-min must be positive");
        Assert.isTrue(backoffMax.compareTo(backoffMin) >= 0, "catalog.backoff-max must not be below backoff-min");
    }

    public String getCatalogKey() {
        return catalogKey;
    }

    public void setCatalogKey(String catalogKey) {
        this.catalogKey = catalogKey;
    }

    public String getEmbeddingsKey() {
        return embeddingsKey;
    }

    public void setEmbeddingsKey(String embeddingsKey) {
        this.embeddingsKey = embeddingsKey;
    }

    public String getUploadStatusPrefix() {
        return uploadStatusPrefix;
    }

    public void setUploadStatusPrefix(String uploadStatusPrefix) {
        this.uploadStatusPrefix = uploadStatusPrefix;
    }

    public String getImagesPrefix() {
        return imagesPrefix;
    }

    public void setImagesPrefix(String imagesPrefix) {
        this.imagesPrefix = imagesPrefix;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffMin() {
        return backoffMin;
    }

    public void setBackoffMin(Duration backoffMin) {
        this.backoffMin = backoffMin;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }
}
