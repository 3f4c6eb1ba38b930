package net.fiddleserver.support.s3;

import java.util.List;
import net.fiddleserver.domain.sandbox.FileContent;
import net.fiddleserver.service.s3.S3FetchResult;

/**
 * Read-only port onto the bucket holding the published sandbox bundles.
 */
public interface ObjectStore {

    /**
     * Lists the top-level common prefixes of the bucket using {@code delimiter} as grouping separator.
     *
     * @throws IllegalStateException when the store cannot be enumerated
     */
    List<String> listCommonPrefixes(String delimiter);

    /**
     * Reads one object with its metadata.
     */
    S3FetchResult<FileContent> fetchObject(String key);

    String bucketName();
}
