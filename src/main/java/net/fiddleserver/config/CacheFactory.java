package net.fiddleserver.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 * Centralizes cache creation for the sandbox file memo and the gist metadata cache.
 */
@Component
@Slf4j
public class CacheFactory {

    /**
     * Create a cache with TTL only (no size limit). Entries expire a fixed time after they were
     * written, however often they are read.
     */
    public <K, V> Cache<K, V> createCacheWithTtl(String name, Duration ttl) {
        return createCacheWithTtl(name, ttl, Ticker.systemTicker());
    }

    /**
     * Same as {@link #createCacheWithTtl(String, Duration)}, measuring entry age with {@code ticker}.
     */
    public <K, V> Cache<K, V> createCacheWithTtl(String name, Duration ttl, Ticker ticker) {
        log.debug("Creating cache '{}' with expire-after-write {}", name, ttl);
        return Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .recordStats()
            .build();
    }

    /**
     * Create a cache without size limit or expiry, for memoizing immutable content.
     */
    public <K, V> Cache<K, V> createUnboundedCache(String name) {
        log.debug("Creating unbounded cache '{}'", name);
        return Caffeine.newBuilder()
            .recordStats()
            .build();
    }
}
