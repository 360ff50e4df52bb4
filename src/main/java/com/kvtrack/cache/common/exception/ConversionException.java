package com.kvtrack.cache.common.exception;

/**
 * Thrown when a coercion cannot convert a stored payload to the requested type.
 */
public class ConversionException extends BaseCacheException {
    public static final String DEFAULT_ERROR_CODE = "ERR-CONV-001";

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
