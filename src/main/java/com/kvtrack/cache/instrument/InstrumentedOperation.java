package com.kvtrack.cache.instrument;

/**
 * A single-argument operation that wrappers can be stacked around.
 */
@FunctionalInterface
public interface InstrumentedOperation<A, R> {

    R invoke(A argument);
}
