package com.kvtrack.cache.fetch;

/**
 * The slow retrieval the fetch cache sits in front of.
 * Failures are reported as {@link com.kvtrack.cache.common.exception.UpstreamFetchException}.
 */
@FunctionalInterface
public interface ResourceFetcher {

    String fetch(String resource);
}
