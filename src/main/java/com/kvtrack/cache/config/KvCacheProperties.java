package com.kvtrack.cache.config;

import com.kvtrack.cache.common.constants.CacheConsts;
import com.kvtrack.cache.fetch.AccessCountPolicy;
import com.kvtrack.cache.fetch.CacheKeyScheme;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the object store instrumentation and the expiring fetch cache.
 */
@Getter
@Setter
@ConfigurationProperties("kv.cache")
public class KvCacheProperties {

    private Fetch fetch = new Fetch();
    private Instrumentation instrumentation = new Instrumentation();

    @Getter
    @Setter
    public static class Fetch {
        private Duration defaultExpire = CacheConsts.Fetch.DEFAULT_EXPIRE;
        // fixed per deployment; switching orphans existing entries
        private CacheKeyScheme keyScheme = CacheKeyScheme.HASHED;
        private AccessCountPolicy countPolicy = AccessCountPolicy.EVERY_REQUEST;
        private Duration connectTimeout = CacheConsts.Fetch.CONNECT_TIMEOUT;
        private Duration requestTimeout = CacheConsts.Fetch.REQUEST_TIMEOUT;
    }

    @Getter
    @Setter
    public static class Instrumentation {
        private boolean serializeCalls = true;
    }
}
