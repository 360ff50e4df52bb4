package com.kvtrack.cache.instrument;

import com.kvtrack.cache.backend.KeyValueBackend;

/**
 * Builds a wrapper chain around one operation. Wrappers are applied in the order requested,
 * each new one enclosing the previous chain.
 *
 * <pre>
 * Instrumentation.of(id, backend, serializer).wrap(op)
 *         .recorded()
 *         .counted()
 *         .serialized()
 *         .build();
 * </pre>
 */
public final class Instrumentation {

    private final OperationId id;
    private final KeyValueBackend backend;
    private final CallSerializer serializer;

    private Instrumentation(OperationId id, KeyValueBackend backend, CallSerializer serializer) {
        this.id = id;
        this.backend = backend;
        this.serializer = serializer;
    }

    public static Instrumentation of(OperationId id, KeyValueBackend backend, CallSerializer serializer) {
        return new Instrumentation(id, backend, serializer);
    }

    public <A, R> Chain<A, R> wrap(InstrumentedOperation<A, R> operation) {
        return new Chain<>(operation);
    }

    public OperationId id() {
        return id;
    }

    public final class Chain<A, R> {
        private InstrumentedOperation<A, R> current;

        private Chain(InstrumentedOperation<A, R> operation) {
            this.current = operation;
        }

        public Chain<A, R> counted() {
            current = new CountingOperation<>(id, backend, current);
            return this;
        }

        public Chain<A, R> recorded() {
            current = new HistoryRecordingOperation<>(id, backend, serializer, current);
            return this;
        }

        public Chain<A, R> serialized() {
            current = new SerializedOperation<>(current);
            return this;
        }

        public InstrumentedOperation<A, R> build() {
            return current;
        }
    }
}
