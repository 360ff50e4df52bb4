package com.kvtrack.cache.common.exception;

/**
 * Exception for validation errors in the application.
 */
public class ValidationException extends BaseCacheException {
    public static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
