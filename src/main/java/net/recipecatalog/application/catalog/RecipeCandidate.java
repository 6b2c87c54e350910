package net.recipecatalog.application.catalog;

import java.util.List;
import java.util.Objects;
import net.recipecatalog.domain.catalog.Recipe;

/**
 * A parsed recipe waiting to be appended, with the image URLs found for it.
 */
public record RecipeCandidate(Recipe recipe, List<String> imageSearchResults) {

    public RecipeCandidate {
        Objects.requireNonNull(recipe, "recipe");
        imageSearchResults = imageSearchResults == null ? List.of() : List.copyOf(imageSearchResults);
    }
}
