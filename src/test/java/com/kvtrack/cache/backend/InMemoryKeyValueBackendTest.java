package com.kvtrack.cache.backend;

import com.kvtrack.cache.common.exception.BackendUnavailableException;
import com.kvtrack.cache.common.exception.ConversionException;
import com.kvtrack.cache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryKeyValueBackendTest {

    MutableClock clock;
    InMemoryKeyValueBackend kv;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        kv = new InMemoryKeyValueBackend(clock);
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static List<String> strings(List<byte[]> in) {
        return in.stream().map(x -> new String(x, StandardCharsets.UTF_8)).collect(Collectors.toList());
    }

    @Test
    void getOfUnknownKeyIsEmpty() {
        assertThat(kv.get("nope")).isEmpty();
        assertThat(kv.exists("nope")).isFalse();
    }

    @Test
    void incrStartsAtOneAndCounts() {
        assertThat(kv.incr("c")).isEqualTo(1L);
        assertThat(kv.incr("c")).isEqualTo(2L);
        assertThat(kv.get("c")).hasValueSatisfying(v -> assertThat(new String(v)).isEqualTo("2"));
    }

    @Test
    void incrOnNonNumericValueFails() {
        kv.set("t", b("abc"));
        assertThatThrownBy(() -> kv.incr("t")).isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 1000; i++) pool.submit(() -> kv.incr("hot"));
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(kv.incr("hot")).isEqualTo(1001L);
    }

    @Test
    void rpushKeepsOrderAndLrangeHandlesNegativeIndexes() {
        kv.rpush("l", b("a"));
        kv.rpush("l", b("b"));
        assertThat(kv.rpush("l", b("c"))).isEqualTo(3L);

        assertThat(strings(kv.lrange("l", 0, -1))).containsExactly("a", "b", "c");
        assertThat(strings(kv.lrange("l", 1, 1))).containsExactly("b");
        assertThat(strings(kv.lrange("l", -2, -1))).containsExactly("b", "c");
        assertThat(kv.lrange("l", 5, 10)).isEmpty();
        assertThat(kv.lrange("missing", 0, -1)).isEmpty();
    }

    @Test
    void listAndStringKeysDoNotMix() {
        kv.rpush("l", b("a"));
        assertThatThrownBy(() -> kv.get("l")).isInstanceOf(BackendUnavailableException.class);
        kv.set("s", b("x"));
        assertThatThrownBy(() -> kv.rpush("s", b("y"))).isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void setexEntryDisappearsAfterTtl() {
        kv.setex("e", Duration.ofSeconds(10), b("page"));
        assertThat(kv.ttl("e")).hasValue(10L);

        clock.advance(Duration.ofSeconds(9));
        assertThat(kv.get("e")).isPresent();
        assertThat(kv.ttl("e")).hasValue(1L);

        clock.advance(Duration.ofSeconds(1));
        assertThat(kv.get("e")).isEmpty();
        assertThat(kv.exists("e")).isFalse();
        assertThat(kv.ttl("e")).isEmpty();
    }

    @Test
    void hugeTtlSaturatesInsteadOfWrappingIntoThePast() {
        kv.setex("far", Duration.ofSeconds(Long.MAX_VALUE / 1000), b("v"));

        assertThat(kv.get("far")).isPresent();
        assertThat(kv.ttl("far").getAsLong()).isPositive();
        clock.advance(Duration.ofDays(365 * 100));
        assertThat(kv.exists("far")).isTrue();
    }

    @Test
    void ttlBeyondMillisecondRangeDoesNotThrow() {
        kv.setex("far", Duration.ofSeconds(Long.MAX_VALUE), b("v"));

        assertThat(kv.exists("far")).isTrue();
    }

    @Test
    void counterReadsIncrValuesAndRejectsText() {
        assertThat(kv.counter("c")).isZero();
        kv.incr("c");
        kv.incr("c");
        assertThat(kv.counter("c")).isEqualTo(2L);

        kv.set("t", b("hello"));
        assertThatThrownBy(() -> kv.counter("t"))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("hello");
    }

    @Test
    void keysSupportsRedisGlobClassesAndEscapes() {
        kv.set("hello", b("1"));
        kv.set("hallo", b("2"));
        kv.set("hxllo", b("3"));
        kv.set("h*llo", b("4"));
        kv.set("h[llo", b("5"));

        assertThat(kv.keys("h[ae]llo")).containsExactlyInAnyOrder("hello", "hallo");
        assertThat(kv.keys("h[^e]llo")).containsExactlyInAnyOrder("hallo", "hxllo", "h*llo", "h[llo");
        assertThat(kv.keys("h[a-e]llo")).containsExactlyInAnyOrder("hello", "hallo");
        assertThat(kv.keys("h\\*llo")).containsExactly("h*llo");
        assertThat(kv.keys("h[llo")).containsExactly("h[llo");
        assertThat(kv.keys("h?llo")).hasSize(5);
    }

    @Test
    void ttlIsEmptyForPersistentKeys() {
        kv.set("p", b("v"));
        assertThat(kv.ttl("p")).isEmpty();
    }

    @Test
    void setexRejectsNonPositiveTtl() {
        assertThatThrownBy(() -> kv.setex("e", Duration.ZERO, b("v")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keysMatchesGlobAndSkipsExpired() {
        kv.set("cached:a", b("1"));
        kv.setex("cached:b", Duration.ofSeconds(1), b("2"));
        kv.set("count:a", b("3"));
        clock.advance(Duration.ofSeconds(2));

        assertThat(kv.keys("cached:*")).containsExactly("cached:a");
        assertThat(kv.keys("*")).containsExactlyInAnyOrder("cached:a", "count:a");
    }

    @Test
    void deleteAndFlush() {
        kv.set("a", b("1"));
        kv.set("b", b("2"));
        assertThat(kv.delete("a", "zzz")).isEqualTo(1L);
        assertThat(kv.exists("a")).isFalse();

        kv.flushDb();
        assertThat(kv.exists("b")).isFalse();
    }

    @Test
    void storedBytesAreCopied() {
        byte[] v = b("abc");
        kv.set("k", v);
        v[0] = 'z';
        assertThat(new String(kv.get("k").orElseThrow(), StandardCharsets.UTF_8)).isEqualTo("abc");
    }
}
