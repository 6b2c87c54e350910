package net.recipecatalog.adapters.persistence;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import net.recipecatalog.application.upload.UploadStatus;
import net.recipecatalog.exception.DocumentStoreException;
import net.recipecatalog.support.s3.S3ObjectStorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * S3 adapter for upload job status documents.
 *
 * <p>Each job owns its own object, so writes are plain last-writer-wins puts.</p>
 */
public class UploadStatusRepository {

    private static final Logger log = LoggerFactory.getLogger(UploadStatusRepository.class);
    private static final Pattern JOB_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final S3ObjectStorageGateway gateway;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public UploadStatusRepository(S3ObjectStorageGateway gateway, ObjectMapper objectMapper, String keyPrefix) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
    }

    public static boolean isValidJobId(String jobId) {
        return jobId != null && JOB_ID_PATTERN.matcher(jobId).matches();
    }

    /**
     * Overwrites the status document for {@code status.jobId()}.
     */
    public void save(UploadStatus status) {
        String key = statusKey(status.jobId());
        byte[] body;
        try {
            body = objectMapper.writeValueAsString(status).getBytes(StandardCharsets.UTF_8);
        } catch (JacksonException exception) {
            throw new DocumentStoreException(key, "Failed to serialize upload status: " + exception.getMessage(), exception);
        }
        gateway.putObject(key, body, JSON_CONTENT_TYPE);
        log.debug("Upload job {} status is now {}", status.jobId(), status.status().wireValue());
    }

    /**
     * Loads the status document, empty when the job is unknown.
     */
    public Optional<UploadStatus> find(String jobId) {
        String key = statusKey(jobId);
        return gateway.fetchUtf8Object(key).map(stored -> {
            try {
                return objectMapper.readValue(stored.body(), UploadStatus.class);
            } catch (JacksonException exception) {
                throw new DocumentStoreException(key, "Corrupt upload status in " + key + ": " + exception.getMessage(), exception);
            }
        });
    }

    String statusKey(String jobId) {
        if (!isValidJobId(jobId)) {
            throw new IllegalArgumentException("Invalid job id format: " + jobId);
        }
        return keyPrefix + jobId + ".json";
    }
}
