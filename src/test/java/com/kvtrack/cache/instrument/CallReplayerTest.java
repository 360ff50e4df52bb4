package com.kvtrack.cache.instrument;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvtrack.cache.backend.InMemoryKeyValueBackend;
import com.kvtrack.cache.backend.KeyValueBackend;
import com.kvtrack.cache.common.exception.ConversionException;
import com.kvtrack.cache.store.ObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallReplayerTest {

    KeyValueBackend backend;
    ObjectStore cache;
    CallReplayer replayer;

    @BeforeEach
    void setUp() {
        backend = new InMemoryKeyValueBackend();
        cache = new ObjectStore(backend, new CallSerializer(new ObjectMapper()), true);
        replayer = new CallReplayer(backend);
    }

    private String replay(OperationId id) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        replayer.replay(id, new PrintStream(buf, true, StandardCharsets.UTF_8));
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void replayPrintsCountThenOneLinePerCall() {
        String k1 = cache.store("foo");
        String k2 = cache.store("bar");
        String k3 = cache.store(42L);

        String[] lines = replay(ObjectStore.STORE).split("\\R");

        assertThat(lines).containsExactly(
                "Cache.store was called 3 times:",
                "Cache.store(*[\"foo\"]) -> " + k1,
                "Cache.store(*[\"bar\"]) -> " + k2,
                "Cache.store(*[42]) -> " + k3);
    }

    @Test
    void neverCalledOperationReplaysAsZero() {
        assertThat(replay(OperationId.of("Nothing.here"))).isEqualToIgnoringNewLines("Nothing.here was called 0 times:");

        CallTrace trace = replayer.trace(OperationId.of("Nothing.here"));
        assertThat(trace.count()).isZero();
        assertThat(trace.calls()).isEmpty();
    }

    @Test
    void replayIsIdempotentAndReadOnly() {
        cache.store("a");
        cache.store("b");

        String first = replay(ObjectStore.STORE);
        String second = replay(ObjectStore.STORE);

        assertThat(second).isEqualTo(first);
        assertThat(cache.callCount(ObjectStore.STORE)).isEqualTo(2L);
    }

    @Test
    void traceOfAKeyHoldingTextFailsWithConversionError() {
        String key = cache.store("hello");

        assertThatThrownBy(() -> replayer.trace(OperationId.of(key)))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("hello");
    }

    @Test
    void unevenHistoryIsPairedUpToTheShorterList() {
        OperationId id = OperationId.of("Op.uneven");
        backend.incr(id.counterKey());
        backend.incr(id.counterKey());
        backend.rpush(id.inputsKey(), "[1]".getBytes(StandardCharsets.UTF_8));
        backend.rpush(id.inputsKey(), "[2]".getBytes(StandardCharsets.UTF_8));
        backend.rpush(id.outputsKey(), "one".getBytes(StandardCharsets.UTF_8));

        CallTrace trace = replayer.trace(id);

        assertThat(trace.count()).isEqualTo(2L);
        assertThat(trace.calls()).containsExactly(new CallTrace.Call("[1]", "one"));
    }
}
