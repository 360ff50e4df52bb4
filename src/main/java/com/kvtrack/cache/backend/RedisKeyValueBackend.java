package com.kvtrack.cache.backend;

import com.kvtrack.cache.common.exception.BackendUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Redis implementation using a {@code RedisTemplate<String, byte[]>}.
 * Keys are prefixed with the provided prefix; an empty prefix keeps key names exactly as given.
 */
public final class RedisKeyValueBackend implements KeyValueBackend {

    private final RedisTemplate<String, byte[]> redis;
    private final String prefix;

    public RedisKeyValueBackend(RedisTemplate<String, byte[]> redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return call("GET", () -> Optional.ofNullable(redis.opsForValue().get(k(key))));
    }

    @Override
    public void set(String key, byte[] value) {
        call("SET", () -> {
            redis.opsForValue().set(k(key), value);
            return null;
        });
    }

    @Override
    public void setex(String key, Duration ttl, byte[] value) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        call("SETEX", () -> {
            redis.opsForValue().set(k(key), value, ttl);
            return null;
        });
    }

    @Override
    public long incr(String key) {
        Long val = call("INCR", () -> redis.opsForValue().increment(k(key)));
        return val == null ? 0L : val;
    }

    @Override
    public long rpush(String key, byte[] value) {
        Long len = call("RPUSH", () -> redis.opsForList().rightPush(k(key), value));
        return len == null ? 0L : len;
    }

    @Override
    public List<byte[]> lrange(String key, long start, long stop) {
        List<byte[]> out = call("LRANGE", () -> redis.opsForList().range(k(key), start, stop));
        return out == null ? Collections.emptyList() : out;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call("EXISTS", () -> redis.hasKey(k(key))));
    }

    @Override
    public OptionalLong ttl(String key) {
        Long secs = call("TTL", () -> redis.getExpire(k(key)));
        // -2 = no such key, -1 = no expiry
        return (secs == null || secs < 0) ? OptionalLong.empty() : OptionalLong.of(secs);
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) return 0L;
        List<String> prefixed = Arrays.stream(keys).map(this::k).collect(Collectors.toList());
        Long n = call("DEL", () -> redis.delete(prefixed));
        return n == null ? 0L : n;
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> raw = call("KEYS", () -> redis.keys(k(pattern)));
        if (raw == null) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>();
        for (String s : raw) out.add(s.substring(prefix.length()));
        return out;
    }

    @Override
    public void flushDb() {
        call("FLUSHDB", () -> redis.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        }));
    }

    private static <T> T call(String command, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Redis " + command + " failed: " + e.getMessage(), e);
        }
    }
}
