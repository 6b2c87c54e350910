package net.recipecatalog.application.upload;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.Map;
import net.recipecatalog.application.catalog.ItemError;

/**
 * Outcome of {@link RecipeUploadService#upload(String, List)}, addressed by the caller's positions.
 *
 * @param jobId job the upload ran under
 * @param committedKeys keys written to the catalog, in input order
 * @param positionToKey input position to assigned key
 * @param errors soft failures from duplicate screening and the catalog writer, sorted by position
 * @param indexWarning set when the catalog write landed but the embedding merge did not
 */
public record UploadResult(String jobId,
                           List<String> committedKeys,
                           Map<Integer, String> positionToKey,
                           List<ItemError> errors,
                           @Nullable String indexWarning) {

    public UploadResult {
        committedKeys = List.copyOf(committedKeys);
        positionToKey = Map.copyOf(positionToKey);
        errors = List.copyOf(errors);
    }
}
