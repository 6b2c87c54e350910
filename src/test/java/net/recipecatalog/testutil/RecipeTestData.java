package net.recipecatalog.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.recipecatalog.application.catalog.ConflictRetryPolicy;
import net.recipecatalog.application.catalog.RecipeCandidate;
import net.recipecatalog.domain.catalog.Recipe;
import net.recipecatalog.domain.catalog.RecipeCatalog;

/**
 * Fixtures shared by the catalog tests.
 */
public final class RecipeTestData {

    public static final String CATALOG_KEY = "jsondata/combined_data.json";
    public static final String EMBEDDINGS_KEY = "jsondata/recipe_embeddings.json";
    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private RecipeTestData() {
    }

    public static Recipe recipe(String title) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Recipe.TITLE, title);
        fields.put("Ingredients", List.of("1 cup water"));
        fields.put("Directions", List.of("Boil."));
        fields.put("Servings", 2);
        return Recipe.of(fields);
    }

    public static RecipeCandidate candidate(String title) {
        return new RecipeCandidate(recipe(title), List.of("https://img.example.com/" + title.strip() + ".jpg"));
    }

    public static RecipeCandidate candidateWithoutImages(String title) {
        return new RecipeCandidate(recipe(title), List.of());
    }

    /**
     * Catalog with the given titles under keys {@code "1".."n"}.
     */
    public static RecipeCatalog catalogOf(String... titles) {
        Map<String, Recipe> recipes = new LinkedHashMap<>();
        for (int i = 0; i < titles.length; i++) {
            String key = Integer.toString(i + 1);
            recipes.put(key, recipe(titles[i]).stampedForCatalog(key, NOW, List.of()));
        }
        return RecipeCatalog.of(recipes);
    }

    /**
     * Catalog holding one recipe per {@code key}, titled {@code "Recipe <key>"}.
     */
    public static RecipeCatalog catalogWithKeys(String... keys) {
        Map<String, Recipe> recipes = new LinkedHashMap<>();
        for (String key : keys) {
            recipes.put(key, recipe("Recipe " + key).stampedForCatalog(key, NOW, List.of()));
        }
        return RecipeCatalog.of(recipes);
    }

    /**
     * Retry policy with default attempts whose pauses are recorded instead of slept.
     */
    public static ConflictRetryPolicy recordingPolicy(List<Duration> pauses) {
        return new ConflictRetryPolicy(ConflictRetryPolicy.DEFAULT_MAX_ATTEMPTS,
            ConflictRetryPolicy.DEFAULT_BACKOFF_MIN, ConflictRetryPolicy.DEFAULT_BACKOFF_MAX, pauses::add);
    }

    public static ConflictRetryPolicy noPausePolicy() {
        return recordingPolicy(new ArrayList<>());
    }
}
