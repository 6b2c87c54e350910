/**
 * Spring {@link org.springframework.context.annotation.Condition} that gates the S3 client
 * on the presence of credentials and a bucket name.
 */
package net.recipecatalog.config;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;

public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean messageLogged = new AtomicBoolean(false);

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Environment environment = context.getEnvironment();
        boolean hasAccessKey = hasText(firstNonBlank(environment, "s3.access-key-id", "S3_ACCESS_KEY_ID"));
        boolean hasSecretKey = hasText(firstNonBlank(environment, "s3.secret-access-key", "S3_SECRET_ACCESS_KEY"));
        String bucket = firstNonBlank(environment, "s3.bucket-name", "S3_BUCKET");
        boolean enabled = hasAccessKey && hasSecretKey && hasText(bucket);

        // startup evaluates this condition more than once
        if (messageLogged.compareAndSet(false, true)) {
            if (enabled) {
                logger.info("S3 configuration detected - catalog storage enabled (bucket: {})", bucket);
            } else {
                logger.error("S3 configuration incomplete - catalog storage DISABLED (S3_ACCESS_KEY_ID={}, S3_SECRET_ACCESS_KEY={}, S3_BUCKET={})",
                    describe(hasAccessKey), describe(hasSecretKey), describe(hasText(bucket)));
                logger.error("Every catalog read and write will fail until the S3 settings are provided");
            }
        }
        return enabled;
    }

    static String firstNonBlank(Environment environment, String... keys) {
        for (String key : keys) {
            String value = environment.getProperty(key);
            if (hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static String describe(boolean present) {
        return present ? "SET" : "MISSING";
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
