package com.kvtrack.cache.fetch;

import com.kvtrack.cache.backend.KeyValueBackend;
import com.kvtrack.cache.common.constants.CacheConsts;
import com.kvtrack.cache.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Memoizes a slow {@link ResourceFetcher} in the backend with a per-entry TTL and counts accesses per resource.
 * <p>
 * Per resource the entry is either absent (never cached or expired, the two look the same) or valid until its TTL
 * runs out. Entries are only written on a miss and only the backend removes them. Concurrent misses for the same
 * resource both go upstream and the last write wins.
 * <p>
 * An upstream failure propagates unchanged: nothing is cached and the access count is not rolled back.
 */
@Slf4j
public class ExpiringFetchCache {

    private final KeyValueBackend backend;
    private final ResourceFetcher fetcher;
    private final CacheKeyScheme keyScheme;
    private final AccessCountPolicy countPolicy;
    private final Duration defaultExpire;

    public ExpiringFetchCache(KeyValueBackend backend, ResourceFetcher fetcher, CacheKeyScheme keyScheme,
                              AccessCountPolicy countPolicy, Duration defaultExpire) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.keyScheme = Objects.requireNonNull(keyScheme, "keyScheme");
        this.countPolicy = Objects.requireNonNull(countPolicy, "countPolicy");
        this.defaultExpire = requireExpire(defaultExpire);
    }

    public String fetch(String resource) {
        return fetch(resource, defaultExpire);
    }

    public String fetch(String resource, Duration expire) {
        requireResource(resource);
        requireExpire(expire);

        final String countKey = keyScheme.countKey(resource);
        final String cacheKey = keyScheme.cacheKey(resource);

        if (countPolicy == AccessCountPolicy.EVERY_REQUEST) {
            backend.incr(countKey);
        }

        Optional<byte[]> cached = backend.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", resource);
            return new String(cached.get(), StandardCharsets.UTF_8);
        }

        log.debug("Cache miss for {}, fetching upstream", resource);
        if (countPolicy == AccessCountPolicy.MISS_ONLY) {
            backend.incr(countKey);
        }
        String fresh = fetcher.fetch(resource);
        if (fresh == null) fresh = "";

        backend.setex(cacheKey, expire, fresh.getBytes(StandardCharsets.UTF_8));
        return fresh;
    }

    // ---------- auxiliary helpers (off the hot path) ----------

    public long accessCount(String resource) {
        requireResource(resource);
        return backend.counter(keyScheme.countKey(resource));
    }

    public boolean isCached(String resource) {
        requireResource(resource);
        return backend.exists(keyScheme.cacheKey(resource));
    }

    public OptionalLong remainingTtlSeconds(String resource) {
        requireResource(resource);
        return backend.ttl(keyScheme.cacheKey(resource));
    }

    /**
     * Keys of all live cache entries. Empty under {@link CacheKeyScheme#RAW}, whose entries carry no prefix.
     */
    public Set<String> cachedEntryKeys() {
        String pattern = keyScheme.cacheKeyPattern();
        return pattern == null ? Collections.emptySet() : backend.keys(pattern);
    }

    private static void requireResource(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new ValidationException("resource identifier required");
        }
    }

    private static Duration requireExpire(Duration expire) {
        if (expire == null || expire.isZero() || expire.isNegative()) {
            throw new ValidationException("expire must be positive, got " + expire);
        }
        if (expire.compareTo(CacheConsts.Fetch.MAX_EXPIRE) > 0) {
            throw new ValidationException("expire must not exceed " + CacheConsts.Fetch.MAX_EXPIRE + ", got " + expire);
        }
        return expire;
    }
}
