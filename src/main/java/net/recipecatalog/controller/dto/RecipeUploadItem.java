package net.recipecatalog.controller.dto;

import java.util.List;
import java.util.Map;

/**
 * One recipe in a batch upload request.
 *
 * @param recipe recipe fields as parsed upstream ({@code Title}, {@code Ingredients}, ...)
 * @param imageSearchResults candidate image URLs
 * @param embedding optional text embedding used for duplicate screening
 */
public record RecipeUploadItem(Map<String, Object> recipe, List<String> imageSearchResults, double[] embedding) {
}
