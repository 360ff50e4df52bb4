package com.kvtrack.cache.store;

import com.kvtrack.cache.backend.KeyValueBackend;
import com.kvtrack.cache.instrument.CallSerializer;
import com.kvtrack.cache.instrument.Instrumentation;
import com.kvtrack.cache.instrument.InstrumentedOperation;
import com.kvtrack.cache.instrument.OperationId;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores payloads under fresh UUID keys and reads them back, optionally coerced.
 * {@link #store} is counted and history-recorded under {@link #STORE}.
 */
@Slf4j
public class ObjectStore {

    public static final OperationId STORE = OperationId.of("Cache.store");

    private final KeyValueBackend backend;
    private final InstrumentedOperation<StoredValue, String> storeOp;

    public ObjectStore(KeyValueBackend backend, CallSerializer serializer, boolean serializeCalls) {
        this.backend = Objects.requireNonNull(backend, "backend");
        Instrumentation.Chain<StoredValue, String> chain = Instrumentation.of(STORE, backend, serializer)
                .wrap(this::write)
                .recorded()
                .counted();
        this.storeOp = serializeCalls ? chain.serialized().build() : chain.build();
    }

    public String store(StoredValue value) {
        Objects.requireNonNull(value, "value");
        return storeOp.invoke(value);
    }

    public String store(String text) {
        return store(StoredValue.text(text));
    }

    public String store(byte[] bytes) {
        return store(StoredValue.bytes(bytes));
    }

    public String store(long integer) {
        return store(StoredValue.integer(integer));
    }

    public String store(double floating) {
        return store(StoredValue.floating(floating));
    }

    public Optional<byte[]> retrieve(String key) {
        return backend.get(key);
    }

    public <T> Optional<T> retrieve(String key, Coercion<T> coercion) {
        Objects.requireNonNull(coercion, "coercion");
        return backend.get(key).map(coercion::apply);
    }

    public Optional<String> retrieveAsText(String key) {
        return retrieve(key, Coercions.TEXT);
    }

    public Optional<Long> retrieveAsInteger(String key) {
        return retrieve(key, Coercions.INTEGER);
    }

    public Optional<Double> retrieveAsFloat(String key) {
        return retrieve(key, Coercions.FLOAT);
    }

    public boolean contains(String key) {
        return backend.exists(key);
    }

    /**
     * Times the operation was invoked; 0 if never.
     */
    public long callCount(OperationId id) {
        return backend.counter(id.counterKey());
    }

    private String write(StoredValue value) {
        String key = UUID.randomUUID().toString();
        backend.set(key, value.encode());
        log.debug("Stored {} under {}", value.getKind(), key);
        return key;
    }
}
