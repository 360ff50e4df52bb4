package com.kvtrack.cache.common.exception;

/**
 * Thrown when the slow upstream retrieval behind the fetch cache fails.
 */
public class UpstreamFetchException extends BaseCacheException {
    public static final String DEFAULT_ERROR_CODE = "ERR-FETCH-001";

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
