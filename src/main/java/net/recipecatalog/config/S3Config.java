package net.recipecatalog.config;

import java.net.URI;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * S3 client for the catalog bucket.
 *
 * <p>Only active when {@link S3EnvironmentCondition} finds credentials and a bucket. A custom
 * endpoint (MinIO and other S3-compatible stores) switches the client to path-style access.</p>
 */
@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {

    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);
    private static final Duration API_CALL_TIMEOUT = Duration.ofSeconds(30);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String serverUrl;
    private final String region;

    public S3Config(@Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}") String accessKeyId,
                    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}") String secretAccessKey,
                    @Value("${s3.server-url:${S3_SERVER_URL:}}") String serverUrl,
                    @Value("${s3.region:${AWS_REGION:us-west-2}}") String region) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.serverUrl = serverUrl;
        this.region = region;
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        if (!hasText(accessKeyId) || !hasText(secretAccessKey)) {
            throw new IllegalStateException("S3 credentials are incomplete. Ensure s3.access-key-id and s3.secret-access-key are configured.");
        }
        try {
            var builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                    .apiCallTimeout(API_CALL_TIMEOUT)
                    .build());
            if (hasText(serverUrl)) {
                builder.endpointOverride(URI.create(serverUrl)).forcePathStyle(true);
                logger.info("Configuring S3Client with custom endpoint {} and region {}", serverUrl, region);
            } else {
                logger.info("Configuring S3Client for AWS-managed endpoint in region {}", region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client bean due to configuration error", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
