package net.recipecatalog.domain.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the catalog document ({@code recipe_key -> Recipe}).
 *
 * <p>Every mutator returns a new snapshot, so an attempt that loses its conditional
 * write cannot leak partial changes into the next attempt.</p>
 */
public final class RecipeCatalog {

    private static final RecipeCatalog EMPTY = new RecipeCatalog(new LinkedHashMap<>());

    private final Map<String, Recipe> recipes;

    private RecipeCatalog(LinkedHashMap<String, Recipe> recipes) {
        this.recipes = Collections.unmodifiableMap(recipes);
    }

    public static RecipeCatalog empty() {
        return EMPTY;
    }

    public static RecipeCatalog of(Map<String, Recipe> recipes) {
        Objects.requireNonNull(recipes, "recipes");
        return recipes.isEmpty() ? EMPTY : new RecipeCatalog(new LinkedHashMap<>(recipes));
    }

    public int size() {
        return recipes.size();
    }

    public boolean isEmpty() {
        return recipes.isEmpty();
    }

    public boolean containsKey(String key) {
        return recipes.containsKey(key);
    }

    public Optional<Recipe> find(String key) {
        return Optional.ofNullable(recipes.get(key));
    }

    /**
     * First key to try for a new recipe: {@code count + 1}, never the highest existing key.
     */
    public int nextKeyCandidate() {
        return recipes.size() + 1;
    }

    /**
     * Smallest free key at or above {@code candidate}. Catalogs that lost entries to
     * deletes can already hold {@code count + 1}; those keys are skipped, not overwritten.
     */
    public int firstFreeKeyFrom(int candidate) {
        int key = candidate;
        while (recipes.containsKey(Integer.toString(key))) {
            key++;
        }
        return key;
    }

    public RecipeCatalog with(String key, Recipe recipe) {
        LinkedHashMap<String, Recipe> copy = new LinkedHashMap<>(recipes);
        copy.put(key, recipe);
        return new RecipeCatalog(copy);
    }

    /**
     * Returns this snapshot unchanged when the key is absent.
     */
    public RecipeCatalog without(String key) {
        if (!recipes.containsKey(key)) {
            return this;
        }
        LinkedHashMap<String, Recipe> copy = new LinkedHashMap<>(recipes);
        copy.remove(key);
        return new RecipeCatalog(copy);
    }

    public Map<String, Recipe> asMap() {
        return recipes;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof RecipeCatalog catalog && recipes.equals(catalog.recipes);
    }

    @Override
    public int hashCode() {
        return recipes.hashCode();
    }

    @Override
    public String toString() {
        return "RecipeCatalog{size=" + recipes.size() + ", keys=" + recipes.keySet() + "}";
    }
}
