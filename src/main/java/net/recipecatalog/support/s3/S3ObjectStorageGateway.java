package net.recipecatalog.support.s3;

import java.util.Objects;
import java.util.Optional;
import net.recipecatalog.exception.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.Nullable;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Infrastructure adapter for S3 object operations used by the catalog documents.
 *
 * <p>This gateway centralizes all direct AWS SDK usage. It translates the SDK's
 * outcomes into the three the catalog cares about: object absent, conditional write
 * lost, and everything else (a {@link DocumentStoreException}).</p>
 */
public final class S3ObjectStorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageGateway.class);

    static final String JSON_CONTENT_TYPE = "application/json";
    private static final String CREATE_ONLY = "*";
    private static final int STATUS_NOT_FOUND = 404;
    private static final int STATUS_CONFLICT = 409;
    private static final int STATUS_PRECONDITION_FAILED = 412;
    private static final String CONDITIONAL_REQUEST_CONFLICT = "ConditionalRequestConflict";

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStorageGateway(@Nullable S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    /**
     * Validates startup configuration for this adapter.
     */
    public void validateConfiguration() {
        if (s3Client == null) {
            logger.warn("S3 object storage gateway initialized without an S3 client. Catalog operations are disabled.");
            return;
        }
        if (!hasText(bucketName)) {
            throw new IllegalStateException("S3 bucket name must be configured when S3 object storage is active.");
        }
    }

    /**
     * Fetches a UTF-8 object and its ETag.
     *
     * @return empty when the key does not exist
     * @throws DocumentStoreException for any other failure
     */
    public Optional<StoredObject> fetchUtf8Object(String key) {
        S3Client client = requireClient("fetch", key);
        try {
            GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
            ResponseBytes<GetObjectResponse> objectBytes = client.getObjectAsBytes(getObjectRequest);
            String eTag = objectBytes.response().eTag();
            if (!hasText(eTag)) {
                throw new DocumentStoreException(key, "S3 returned no ETag for key " + key);
            }
            logger.debug("Fetched {} ({} bytes, ETag {})", key, objectBytes.asByteArray().length, eTag);
            return Optional.of(new StoredObject(objectBytes.asUtf8String(), eTag));
        } catch (NoSuchKeyException exception) {
            logger.info("S3 key {} not found in bucket {}", key, bucketName);
            return Optional.empty();
        } catch (S3Exception exception) {
            if (exception.statusCode() == STATUS_NOT_FOUND) {
                logger.info("S3 key {} not found in bucket {}", key, bucketName);
                return Optional.empty();
            }
            throw new DocumentStoreException(key,
                "S3 error fetching key " + key + " from bucket " + bucketName + ": " + resolveS3ErrorMessage(exception),
                exception);
        } catch (SdkClientException | IllegalArgumentException exception) {
            throw new DocumentStoreException(key,
                "Unexpected error fetching key " + key + " from bucket " + bucketName + ": " + exception.getMessage(),
                exception);
        }
    }

    /**
     * Writes a JSON body only if the stored object is still at {@code expectedETag}.
     *
     * <p>A {@code null} ETag means "create": the write is sent with {@code If-None-Match: *}
     * and loses if another writer created the object first.</p>
     *
     * @return {@code true} when written, {@code false} when the precondition failed
     * @throws DocumentStoreException for any other failure
     */
    public boolean putJsonConditionally(String key, String jsonBody, @Nullable String expectedETag) {
        S3Client client = requireClient("conditional put", key);
        PutObjectRequest.Builder requestBuilder = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(JSON_CONTENT_TYPE);
        if (expectedETag != null) {
            requestBuilder.ifMatch(expectedETag);
        } else {
            requestBuilder.ifNoneMatch(CREATE_ONLY);
        }

        try {
            client.putObject(requestBuilder.build(), RequestBody.fromString(jsonBody));
            logger.info("Conditionally wrote {} to bucket {} (expected ETag {})", key, bucketName, expectedETag);
            return true;
        } catch (S3Exception exception) {
            if (isConditionalWriteConflict(exception)) {
                logger.warn("Precondition failed writing {} (expected ETag {}): {}",
                    key, expectedETag, resolveS3ErrorMessage(exception));
                return false;
            }
            throw new DocumentStoreException(key,
                "S3 error writing key " + key + " to bucket " + bucketName + ": " + resolveS3ErrorMessage(exception),
                exception);
        } catch (SdkClientException | IllegalArgumentException exception) {
            throw new DocumentStoreException(key,
                "Unexpected error writing key " + key + " to bucket " + bucketName + ": " + exception.getMessage(),
                exception);
        }
    }

    /**
     * Unconditionally writes bytes under {@code key}.
     */
    public void putObject(String key, byte[] payload, String contentType) {
        S3Client client = requireClient("put", key);
        try {
            PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();
            client.putObject(putObjectRequest, RequestBody.fromBytes(payload));
            logger.info("Successfully uploaded {} ({} bytes) to S3 bucket {}", key, payload.length, bucketName);
        } catch (S3Exception exception) {
            throw new DocumentStoreException(key,
                "S3 error uploading key " + key + " to bucket " + bucketName + ": " + resolveS3ErrorMessage(exception),
                exception);
        } catch (SdkClientException | IllegalArgumentException exception) {
            throw new DocumentStoreException(key,
                "Unexpected error uploading key " + key + " to bucket " + bucketName + ": " + exception.getMessage(),
                exception);
        }
    }

    /**
     * Deletes an object key from the bucket. Deleting a missing key succeeds.
     */
    public boolean deleteObject(String key) {
        S3Client client = requireClient("delete", key);
        try {
            DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
            client.deleteObject(deleteRequest);
            logger.info("Deleted object {}", key);
            return true;
        } catch (S3Exception exception) {
            throw new DocumentStoreException(key,
                "S3 error deleting object " + key + ": " + resolveS3ErrorMessage(exception),
                exception);
        } catch (SdkClientException | IllegalArgumentException exception) {
            throw new DocumentStoreException(key,
                "Unexpected error deleting object " + key + ": " + exception.getMessage(),
                exception);
        }
    }

    private S3Client requireClient(String operation, String key) {
        if (s3Client == null) {
            throw new DocumentStoreException(key,
                "S3 client is not configured for " + operation + " operation (key: " + key + ")");
        }
        return s3Client;
    }

    static boolean isConditionalWriteConflict(S3Exception exception) {
        if (exception.statusCode() == STATUS_PRECONDITION_FAILED) {
            return true;
        }
        return exception.statusCode() == STATUS_CONFLICT
            && exception.awsErrorDetails() != null
            && CONDITIONAL_REQUEST_CONFLICT.equals(exception.awsErrorDetails().errorCode());
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return Objects.requireNonNullElse(exception.getMessage(), "unknown S3 error");
    }
}
