package com.kvtrack.cache.common.exception;

import lombok.Getter;

/**
 * Base exception class for all cache application exceptions.
 * Carries a stable error code alongside the message.
 */
@Getter
public abstract class BaseCacheException extends RuntimeException {

    private final String errorCode;

    protected BaseCacheException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseCacheException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
