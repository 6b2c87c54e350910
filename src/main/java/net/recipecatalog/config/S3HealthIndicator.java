package net.recipecatalog.config;

import jakarta.annotation.Nullable;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Reports whether the catalog bucket is reachable, exposed as the {@code s3} health component.
 */
@Component("s3HealthIndicator")
public class S3HealthIndicator implements HealthIndicator {

    private static final Duration S3_TIMEOUT = Duration.ofSeconds(5);

    private final S3Client s3Client;
    private final String bucketName;

    /**
     * @param s3Client the S3 client, or null when S3 is not configured
     * @param bucketName the catalog bucket
     */
    public S3HealthIndicator(@Nullable S3Client s3Client,
                             @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public Health health() {
        if (s3Client == null) {
            return Health.down()
                .withDetail("s3_status", "misconfigured_or_disabled")
                .withDetail("detail", "S3Client bean is not available, check S3 configuration and credentials.")
                .build();
        }
        if (bucketName == null || bucketName.isBlank()) {
            return Health.down()
                .withDetail("s3_status", "misconfigured")
                .withDetail("detail", "S3 bucket name is not configured.")
                .build();
        }

        HeadBucketRequest headBucketRequest = HeadBucketRequest.builder()
            .bucket(bucketName)
            .overrideConfiguration(override -> override.apiCallTimeout(S3_TIMEOUT))
            .build();
        try {
            s3Client.headBucket(headBucketRequest);
            return Health.up()
                .withDetail("s3_status", "available")
                .withDetail("bucket", bucketName)
                .build();
        } catch (S3Exception ex) {
            var details = ex.awsErrorDetails();
            String error = details != null
                ? details.errorCode() + ": " + details.errorMessage()
                : ex.getMessage();
            return Health.down()
                .withDetail("s3_status", "s3_error")
                .withDetail("bucket", bucketName)
                .withDetail("error", error)
                .build();
        } catch (SdkClientException ex) {
            return Health.down()
                .withDetail("s3_status", "sdk_client_error")
                .withDetail("bucket", bucketName)
                .withDetail("error", ex.getClass().getName())
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build();
        }
    }
}
