package net.recipecatalog.application.upload;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import net.recipecatalog.domain.catalog.Recipe;

/**
 * One recipe submitted for upload.
 *
 * @param recipe parsed recipe fields
 * @param imageSearchResults candidate image URLs found for the recipe
 * @param embedding text embedding used for duplicate screening; {@code null} skips the screen
 */
public record UploadCandidate(Recipe recipe, List<String> imageSearchResults, @Nullable double[] embedding) {

    public UploadCandidate {
        Objects.requireNonNull(recipe, "recipe");
        imageSearchResults = imageSearchResults == null ? List.of() : List.copyOf(imageSearchResults);
        embedding = embedding == null ? null : embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
