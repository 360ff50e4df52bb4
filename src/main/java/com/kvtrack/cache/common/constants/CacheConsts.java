package com.kvtrack.cache.common.constants;

import java.time.Duration;

/**
 * CacheConsts — key names and defaults shared by the store, the instrumentation and the fetch cache.
 * Key layouts are persisted state: changing them orphans existing entries.
 */
public interface CacheConsts {

    interface Keys {
        String INPUTS_SUFFIX = ":inputs";
        String OUTPUTS_SUFFIX = ":outputs";
        String CACHED_PREFIX = "cached:";
        String COUNT_PREFIX = "count:";
    }

    interface Fetch {
        Duration DEFAULT_EXPIRE = Duration.ofSeconds(10);
        Duration MAX_EXPIRE = Duration.ofDays(365);
        Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
        Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    }
}
