package net.fiddleserver.config;

import java.time.Duration;
import net.fiddleserver.support.s3.ObjectStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@Component("s3HealthIndicator")
public class S3HealthIndicator implements ReactiveHealthIndicator {

    // S3Client is thread-safe and immutable per AWS SDK v2; storing reference is safe
    private final S3Client s3Client;
    private final String bucketName;
    private final Duration timeout;

    @Autowired
    public S3HealthIndicator(S3Client s3Client, ObjectStore objectStore) {
        this(s3Client, objectStore.bucketName(), Duration.ofSeconds(5));
    }

    S3HealthIndicator(S3Client s3Client, String bucketName, Duration timeout) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.timeout = timeout;
    }

    @Override
    public Mono<Health> health() {
        HeadBucketRequest headBucketRequest = HeadBucketRequest.builder()
            .bucket(bucketName)
            .build();

        return Mono.fromCallable(() -> {
                s3Client.headBucket(headBucketRequest);
                return Health.up()
                    .withDetail("s3_status", "available")
                    .withDetail("bucket", bucketName)
                    .build();
            })
            .subscribeOn(Schedulers.boundedElastic()) // Perform S3 call on a separate thread
            .timeout(timeout)
            .onErrorResume(S3Exception.class, ex -> {
                var details = ex.awsErrorDetails();
                String error = (details != null)
                    ? details.errorCode() + ": " + details.errorMessage()
                    : ex.getMessage();
                return Mono.just(Health.down()
                    .withDetail("s3_status", "s3_error")
                    .withDetail("bucket", bucketName)
                    .withDetail("error", String.valueOf(error))
                    .build());
            })
            .onErrorResume(SdkClientException.class, ex -> Mono.just(Health.down()
                .withDetail("s3_status", "client_error")
                .withDetail("bucket", bucketName)
                .withDetail("error", String.valueOf(ex.getMessage()))
                .build()))
            .onErrorResume(java.util.concurrent.TimeoutException.class, ex -> Mono.just(Health.down()
                .withDetail("s3_status", "timeout")
                .withDetail("bucket", bucketName)
                .withDetail("timeout", timeout.toString())
                .build()));
    }
}
