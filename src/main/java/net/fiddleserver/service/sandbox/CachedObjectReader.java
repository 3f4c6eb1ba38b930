package net.fiddleserver.service.sandbox;

import com.github.benmanes.caffeine.cache.Cache;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.domain.sandbox.FileContent;
import net.fiddleserver.exception.ObjectStoreUnavailableException;
import net.fiddleserver.service.s3.S3FetchResult;
import net.fiddleserver.support.s3.ObjectStore;

/**
 * Memoizing file reader scoped to one sandbox version.
 *
 * <p>Each path is fetched from {@code {version}/{path}} at most once per process; found files and
 * missing or denied objects are both kept. Published bundles are immutable, so entries are never
 * invalidated. Store failures are thrown as {@link ObjectStoreUnavailableException} and leave no
 * entry behind, so the next request for the path tries again.</p>
 */
@Slf4j
public final class CachedObjectReader {

    private final ObjectStore objectStore;
    private final String version;
    private final Cache<String, Optional<FileContent>> files;

    public CachedObjectReader(ObjectStore objectStore, String version, Cache<String, Optional<FileContent>> files) {
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.files = Objects.requireNonNull(files, "files cache must not be null");
    }

    /**
     * Returns the file stored under this version, or empty when the store reports it missing or denied.
     *
     * @throws ObjectStoreUnavailableException when the store could not be read
     */
    public Optional<FileContent> get(String path) {
        return files.get(path, this::load);
    }

    long cachedEntryCount() {
        return files.estimatedSize();
    }

    private Optional<FileContent> load(String path) {
        String key = version + "/" + path;
        S3FetchResult<FileContent> result = objectStore.fetchObject(key);
        if (result.isAccessDenied()) {
            log.debug("Key {} is not readable; serving it as absent", key);
        }
        if (result.isServiceError()) {
            throw new ObjectStoreUnavailableException(key,
                result.getErrorMessage().orElse("Object store unavailable for key " + key));
        }
        return result.getData();
    }
}
