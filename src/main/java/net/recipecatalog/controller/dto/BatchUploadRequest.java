package net.recipecatalog.controller.dto;

import java.util.List;

/**
 * Body of {@code POST /api/recipes/batch}. A missing {@code jobId} gets a generated one.
 */
public record BatchUploadRequest(String jobId, List<RecipeUploadItem> recipes) {
}
