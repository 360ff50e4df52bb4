package com.kvtrack.cache.instrument;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one call at a time through the wrapped chain. Placed outermost, it keeps the counter bump and
 * both history appends of a call together, so input i still pairs with output i under concurrent callers.
 * Only covers callers inside this JVM.
 */
public final class SerializedOperation<A, R> implements InstrumentedOperation<A, R> {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final InstrumentedOperation<A, R> delegate;

    public SerializedOperation(InstrumentedOperation<A, R> delegate) {
        this.delegate = delegate;
    }

    @Override
    public R invoke(A argument) {
        lock.lock();
        try {
            return delegate.invoke(argument);
        } finally {
            lock.unlock();
        }
    }
}
