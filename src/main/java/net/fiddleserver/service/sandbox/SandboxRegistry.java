package net.fiddleserver.service.sandbox;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.config.CacheFactory;
import net.fiddleserver.support.s3.ObjectStore;

/**
 * Immutable snapshot of the sandbox versions published in the bundle bucket, each mapped to its
 * own {@link CachedObjectReader}.
 *
 * <p>The snapshot is taken once at startup. Versions published afterwards are not picked up until
 * the process restarts.</p>
 */
@Slf4j
public final class SandboxRegistry {

    static final String DELIMITER = "/";

    private final Map<String, CachedObjectReader> readers;

    SandboxRegistry(Map<String, CachedObjectReader> readers) {
        this.readers = Collections.unmodifiableMap(new TreeMap<>(readers));
    }

    /**
     * Enumerates the bucket's top-level prefixes and builds one reader per version.
     *
     * @throws IllegalStateException when the bucket cannot be listed
     */
    public static SandboxRegistry enumerate(ObjectStore objectStore, CacheFactory cacheFactory) {
        List<String> prefixes = objectStore.listCommonPrefixes(DELIMITER);
        Set<String> versions = new TreeSet<>();
        for (String prefix : prefixes) {
            String version = stripDelimiter(prefix);
            if (!version.isEmpty()) {
                versions.add(version);
            }
        }
        SandboxRegistry registry = of(versions, version -> new CachedObjectReader(objectStore, version,
            cacheFactory.createUnboundedCache("sandbox-files-" + version)));
        log.info("Discovered {} sandbox version(s) in bucket {}: {}",
            registry.versions().size(), objectStore.bucketName(), registry.versions());
        return registry;
    }

    /**
     * Builds a registry over versions supplied directly, one reader per version.
     */
    public static SandboxRegistry of(Set<String> versions, Function<String, CachedObjectReader> readerFactory) {
        Map<String, CachedObjectReader> readers = new TreeMap<>();
        for (String version : versions) {
            readers.put(version, readerFactory.apply(version));
        }
        return new SandboxRegistry(readers);
    }

    public Optional<CachedObjectReader> reader(String version) {
        if (version == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(readers.get(version));
    }

    public Set<String> versions() {
        return readers.keySet();
    }

    public Optional<String> latestVersion() {
        return LatestVersionResolver.resolve(readers.keySet());
    }

    private static String stripDelimiter(String prefix) {
        if (prefix == null) {
            return "";
        }
        String trimmed = prefix;
        while (trimmed.endsWith(DELIMITER)) {
            trimmed = trimmed.substring(0, trimmed.length() - DELIMITER.length());
        }
        return trimmed;
    }
}
