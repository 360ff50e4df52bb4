package com.kvtrack.cache.common.exception;

/**
 * Thrown when the key-value backend cannot be reached or a call to it fails.
 * Never retried here; the caller decides whether to repeat the whole operation.
 */
public class BackendUnavailableException extends BaseCacheException {
    public static final String DEFAULT_ERROR_CODE = "ERR-KV-001";

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
