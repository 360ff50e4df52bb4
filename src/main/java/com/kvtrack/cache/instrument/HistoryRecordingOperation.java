package com.kvtrack.cache.instrument;

import com.kvtrack.cache.backend.KeyValueBackend;

import java.nio.charset.StandardCharsets;

/**
 * Appends the serialized arguments to {@code <id>:inputs} before the call and the result to
 * {@code <id>:outputs} after it. A failing call leaves its input entry without an output.
 */
public final class HistoryRecordingOperation<A, R> implements InstrumentedOperation<A, R> {

    private final OperationId id;
    private final KeyValueBackend backend;
    private final CallSerializer serializer;
    private final InstrumentedOperation<A, R> delegate;

    public HistoryRecordingOperation(OperationId id, KeyValueBackend backend, CallSerializer serializer,
                                     InstrumentedOperation<A, R> delegate) {
        this.id = id;
        this.backend = backend;
        this.serializer = serializer;
        this.delegate = delegate;
    }

    @Override
    public R invoke(A argument) {
        backend.rpush(id.inputsKey(), serializer.arguments(argument).getBytes(StandardCharsets.UTF_8));
        R result = delegate.invoke(argument);
        backend.rpush(id.outputsKey(), serializer.result(result).getBytes(StandardCharsets.UTF_8));
        return result;
    }
}
