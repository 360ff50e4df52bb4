package com.kvtrack.cache.backend;

import com.kvtrack.cache.common.exception.ConversionException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A small port over an external key-value store (Redis in production).
 * Values are raw bytes; keys are strings.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - incr(...) and rpush(...) are atomic single round trips; incr on an absent key yields 1.
 *  - Expired keys are indistinguishable from absent ones.
 *  - Any failure to talk to the store surfaces as BackendUnavailableException.
 */
public interface KeyValueBackend {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    // Write with expiry; ttl must be positive
    void setex(String key, Duration ttl, byte[] value);

    long incr(String key);

    // Append to the tail; returns the new list length
    long rpush(String key, byte[] value);

    // Inclusive range, negative indexes count from the tail (-1 = last)
    List<byte[]> lrange(String key, long start, long stop);

    boolean exists(String key);

    // Remaining seconds; empty when the key is absent or has no expiry
    OptionalLong ttl(String key);

    long delete(String... keys);

    // Redis glob pattern ("cached:*", "h?llo", "h[ae]llo", "h[^e]llo", "h[a-b]llo", \x escapes); not for hot paths
    Set<String> keys(String pattern);

    void flushDb();

    /**
     * Reads an incr-maintained counter; 0 when absent.
     *
     * @throws ConversionException if the key holds something other than a decimal integer
     */
    default long counter(String key) {
        return get(key).map(raw -> {
            String s = new String(raw, StandardCharsets.UTF_8);
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new ConversionException("Key '" + key + "' does not hold a counter: '" + s + "'", e);
            }
        }).orElse(0L);
    }
}
