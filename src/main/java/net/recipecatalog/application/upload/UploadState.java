package net.recipecatalog.application.upload;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of an upload job as seen by a polling client.
 */
public enum UploadState {
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
