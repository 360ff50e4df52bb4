package com.kvtrack.cache.fetch;

/**
 * When the per-resource access counter is bumped.
 */
public enum AccessCountPolicy {
    /**
     * Every fetch attempt counts, hit or miss, failed or not.
     */
    EVERY_REQUEST,
    /**
     * Only attempts that go upstream count.
     */
    MISS_ONLY
}
