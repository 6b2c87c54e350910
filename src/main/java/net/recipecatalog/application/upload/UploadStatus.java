package net.recipecatalog.application.upload;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import net.recipecatalog.application.catalog.ItemError;

/**
 * Job status document stored under {@code upload-status/<jobId>.json}.
 *
 * @param jobId caller-supplied job identifier
 * @param status current state
 * @param total number of recipes submitted
 * @param completed number of recipes committed to the catalog
 * @param committedKeys keys assigned to the committed recipes
 * @param errors soft per-recipe failures
 * @param message job-level failure or warning, if any
 * @param updatedAt when this status was written
 */
public record UploadStatus(String jobId,
                           UploadState status,
                           int total,
                           int completed,
                           List<String> committedKeys,
                           List<ItemError> errors,
                           @Nullable String message,
                           Instant updatedAt) {

    public UploadStatus {
        committedKeys = committedKeys == null ? List.of() : List.copyOf(committedKeys);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static UploadStatus processing(String jobId, int total, Instant now) {
        return new UploadStatus(jobId, UploadState.PROCESSING, total, 0, List.of(), List.of(), null, now);
    }
}
