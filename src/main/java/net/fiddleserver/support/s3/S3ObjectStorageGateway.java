package net.fiddleserver.support.s3;

import java.util.ArrayList;
import java.util.List;
import net.fiddleserver.domain.sandbox.FileContent;
import net.fiddleserver.service.s3.S3FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Infrastructure adapter for read-only S3 access to the bundle bucket.
 *
 * <p>This gateway centralizes all direct AWS SDK usage so the sandbox services only deal with
 * {@link FileContent} and {@link S3FetchResult}.</p>
 */
public final class S3ObjectStorageGateway implements ObjectStore {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageGateway.class);

    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStorageGateway(S3Client s3Client, String bucketName) {
        if (s3Client == null) {
            throw new IllegalStateException("S3 client is not configured. Sandbox bundles cannot be served.");
        }
        if (!hasText(bucketName)) {
            throw new IllegalStateException("S3 bucket name must be configured (s3.bucket-name / S3_BUCKET).");
        }
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public List<String> listCommonPrefixes(String delimiter) {
        logger.info("Listing common prefixes in bucket {} with delimiter '{}'", bucketName, delimiter);
        List<String> prefixes = new ArrayList<>();
        String continuationToken = null;

        try {
            do {
                ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucketName)
                    .delimiter(delimiter)
                    .continuationToken(continuationToken)
                    .build();

                ListObjectsV2Response response = s3Client.listObjectsV2(request);
                for (CommonPrefix commonPrefix : response.commonPrefixes()) {
                    prefixes.add(commonPrefix.prefix());
                }
                continuationToken = response.nextContinuationToken();
                logger.debug("Fetched {} common prefixes from current page.", response.commonPrefixes().size());
            } while (continuationToken != null);
        } catch (S3Exception exception) {
            throw new IllegalStateException(
                "S3 error listing prefixes in bucket " + bucketName + ": " + resolveS3ErrorMessage(exception),
                exception
            );
        } catch (SdkClientException | IllegalArgumentException exception) {
            throw new IllegalStateException(
                "Unexpected error listing prefixes in bucket " + bucketName + ": " + exception.getMessage(),
                exception
            );
        }
        logger.info("Finished listing bucket {}. Prefixes found: {}", bucketName, prefixes.size());
        return List.copyOf(prefixes);
    }

    @Override
    public S3FetchResult<FileContent> fetchObject(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .build();
        try {
            ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(request);
            GetObjectResponse metadata = objectBytes.response();
            logger.debug("Fetched {} from bucket {}", key, bucketName);
            return S3FetchResult.success(new FileContent(
                objectBytes.asByteArray(),
                metadata.contentType(),
                metadata.contentLength(),
                metadata.lastModified(),
                metadata.eTag()
            ));
        } catch (NoSuchKeyException exception) {
            if (logger.isTraceEnabled()) {
                logger.trace("S3 key {} not found: {}", key, exception.getMessage());
            }
            return S3FetchResult.notFound();
        } catch (S3Exception exception) {
            if (exception.statusCode() == HTTP_NOT_FOUND) {
                return S3FetchResult.notFound();
            }
            if (exception.statusCode() == HTTP_FORBIDDEN) {
                logger.warn("S3 denied access to key {}: {}", key, resolveS3ErrorMessage(exception));
                return S3FetchResult.accessDenied(resolveS3ErrorMessage(exception));
            }
            logger.error("S3 error fetching key {}: {}", key, resolveS3ErrorMessage(exception), exception);
            return S3FetchResult.serviceError(resolveS3ErrorMessage(exception));
        } catch (SdkClientException exception) {
            logger.error("S3 client error fetching key {}: {}", key, exception.getMessage(), exception);
            return S3FetchResult.serviceError(String.valueOf(exception.getMessage()));
        }
    }

    @Override
    public String bucketName() {
        return bucketName;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return String.valueOf(exception.getMessage());
    }
}
