package net.recipecatalog.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import net.recipecatalog.application.catalog.ItemError;
import net.recipecatalog.application.upload.UploadResult;

/**
 * Upload outcome; {@code success} is true whenever the batch ran, even with rejections.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchUploadResponse(boolean success,
                                  String jobId,
                                  List<String> committedKeys,
                                  Map<Integer, String> positionToKey,
                                  List<ItemError> errors,
                                  String warning) {

    public static BatchUploadResponse from(UploadResult result) {
        return new BatchUploadResponse(true, result.jobId(), result.committedKeys(), result.positionToKey(),
            result.errors(), result.indexWarning());
    }
}
