package net.recipecatalog.exception;

import java.util.NoSuchElementException;

/**
 * The catalog holds no recipe under the requested key.
 */
public class RecipeNotFoundException extends NoSuchElementException {

    private final String recipeKey;

    public RecipeNotFoundException(String recipeKey) {
        super("Recipe " + recipeKey + " not found");
        this.recipeKey = recipeKey;
    }

    public String getRecipeKey() {
        return recipeKey;
    }
}
