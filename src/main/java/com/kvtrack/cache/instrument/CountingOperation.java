package com.kvtrack.cache.instrument;

import com.kvtrack.cache.backend.KeyValueBackend;

/**
 * Bumps the operation's counter before every invocation, whether or not the call then succeeds.
 */
public final class CountingOperation<A, R> implements InstrumentedOperation<A, R> {

    private final OperationId id;
    private final KeyValueBackend backend;
    private final InstrumentedOperation<A, R> delegate;

    public CountingOperation(OperationId id, KeyValueBackend backend, InstrumentedOperation<A, R> delegate) {
        this.id = id;
        this.backend = backend;
        this.delegate = delegate;
    }

    @Override
    public R invoke(A argument) {
        backend.incr(id.counterKey());
        return delegate.invoke(argument);
    }
}
