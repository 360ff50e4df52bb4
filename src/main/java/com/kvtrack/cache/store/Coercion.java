package com.kvtrack.cache.store;

/**
 * Converts the raw bytes read from the backend into a typed value.
 * Implementations throw {@link com.kvtrack.cache.common.exception.ConversionException} on bad input.
 */
@FunctionalInterface
public interface Coercion<T> {

    T apply(byte[] raw);
}
