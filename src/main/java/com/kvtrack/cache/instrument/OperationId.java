package com.kvtrack.cache.instrument;

import com.kvtrack.cache.common.constants.CacheConsts;

import java.util.Objects;

/**
 * Stable name of an instrumented operation, e.g. {@code Cache.store}.
 * The name is the counter key; history lists hang off it with ":inputs" / ":outputs".
 */
public record OperationId(String name) {

    public OperationId {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("operation name must not be blank");
    }

    public static OperationId of(String name) {
        return new OperationId(name);
    }

    public String counterKey() {
        return name;
    }

    public String inputsKey() {
        return name + CacheConsts.Keys.INPUTS_SUFFIX;
    }

    public String outputsKey() {
        return name + CacheConsts.Keys.OUTPUTS_SUFFIX;
    }

    @Override
    public String toString() {
        return name;
    }
}
