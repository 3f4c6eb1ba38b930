/**
 * Configuration for the Amazon S3 client that reads sandbox bundles
 *
 * Features:
 * - Requires bucket and region; startup aborts when either is missing
 * - Uses static credentials when both keys are configured, the SDK default chain otherwise
 * - Supports custom endpoint URL for MinIO or other S3 compatible services
 * - Enumerates the published sandbox versions once, before traffic is served
 */
package net.fiddleserver.config;

import java.net.URI;
import net.fiddleserver.service.sandbox.SandboxContext;
import net.fiddleserver.service.sandbox.SandboxRegistry;
import net.fiddleserver.support.s3.ObjectStore;
import net.fiddleserver.support.s3.S3ObjectStorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Value("${s3.access-key-id:}")
    private String accessKeyId;

    @Value("${s3.secret-access-key:}")
    private String secretAccessKey;

    @Value("${s3.server-url:}")
    private String s3ServerUrl;

    @Value("${s3.region:}")
    private String s3Region;

    @Value("${s3.bucket-name:}")
    private String bucketName;

    /**
     * Creates and configures S3Client bean for bundle reads
     *
     * @return Configured S3Client instance
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        if (!hasText(s3Region)) {
            throw new IllegalStateException("S3 region is not configured. Set s3.region or S3_REGION.");
        }

        try {
            var builder = S3Client.builder().region(Region.of(s3Region));
            if (hasText(accessKeyId) && hasText(secretAccessKey)) {
                builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(accessKeyId, secretAccessKey)));
            } else {
                builder.credentialsProvider(DefaultCredentialsProvider.create());
            }
            if (hasText(s3ServerUrl)) {
                builder.endpointOverride(URI.create(s3ServerUrl));
                logger.info("Configuring S3Client with custom endpoint {} and region {}", s3ServerUrl, s3Region);
            } else {
                logger.info("Configuring S3Client for AWS-managed endpoint in region {}", s3Region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client bean due to configuration error", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    @Bean
    public ObjectStore objectStore(S3Client s3Client) {
        return new S3ObjectStorageGateway(s3Client, bucketName);
    }

    /**
     * Lists the bucket once; a failure here aborts startup.
     */
    @Bean
    public SandboxRegistry sandboxRegistry(ObjectStore objectStore, CacheFactory cacheFactory) {
        return SandboxRegistry.enumerate(objectStore, cacheFactory);
    }

    @Bean
    public SandboxContext sandboxContext(SandboxRegistry sandboxRegistry) {
        SandboxContext context = SandboxContext.from(sandboxRegistry);
        if (context.defaultVersion().isPresent()) {
            logger.info("Latest sandbox version: {}", context.latestVersion());
        } else {
            logger.warn("Bucket {} holds no sandbox versions; every page request will answer 404", bucketName);
        }
        return context;
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
