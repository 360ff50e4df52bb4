package com.kvtrack.cache.backend;

import com.kvtrack.cache.common.exception.BackendUnavailableException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * In-memory implementation of KeyValueBackend.
 * Intended for local/dev/testing only (single JVM). Mutations go through
 * {@link ConcurrentMap#compute} so incr and rpush stay atomic per key.
 */
public final class InMemoryKeyValueBackend implements KeyValueBackend {

    private static final class Entry {
        final byte[] value;        // string entry
        final List<byte[]> list;   // list entry (immutable snapshot)
        final long expAtMillis;    // 0 = no expiry

        Entry(byte[] value, List<byte[]> list, long expAtMillis) {
            this.value = value;
            this.list = list;
            this.expAtMillis = expAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueBackend(Clock clock) {
        this.clock = clock;
    }

    private long now() {
        return clock.millis();
    }

    private static boolean isExpired(Entry e, long now) {
        return e != null && e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private Entry live(String key) {
        final long n = now();
        final Entry e = map.get(key);
        if (isExpired(e, n)) {
            map.remove(key, e);
            return null;
        }
        return e;
    }

    @Override
    public Optional<byte[]> get(String key) {
        final Entry e = live(key);
        if (e == null) return Optional.empty();
        if (e.list != null) throw wrongType(key);
        return Optional.of(e.value.clone());
    }

    @Override
    public void set(String key, byte[] value) {
        map.put(key, new Entry(value.clone(), null, 0L));
    }

    @Override
    public void setex(String key, Duration ttl, byte[] value) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        map.put(key, new Entry(value.clone(), null, expiryAt(ttl)));
    }

    // saturates at Long.MAX_VALUE instead of wrapping into the past
    private long expiryAt(Duration ttl) {
        try {
            return Math.addExact(now(), ttl.toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public long incr(String key) {
        final long n = now();
        final Entry next = map.compute(key, (k, cur) -> {
            if (cur == null || isExpired(cur, n)) {
                return new Entry(ascii(1L), null, 0L);
            }
            if (cur.list != null) throw wrongType(k);
            final long val;
            try {
                val = Long.parseLong(new String(cur.value, StandardCharsets.US_ASCII));
            } catch (NumberFormatException ex) {
                throw new BackendUnavailableException("ERR value is not an integer or out of range");
            }
            // preserve existing expiry window
            return new Entry(ascii(val + 1L), null, cur.expAtMillis);
        });
        return Long.parseLong(new String(next.value, StandardCharsets.US_ASCII));
    }

    @Override
    public long rpush(String key, byte[] value) {
        final long n = now();
        final Entry next = map.compute(key, (k, cur) -> {
            final List<byte[]> grown = new ArrayList<>();
            long exp = 0L;
            if (cur != null && !isExpired(cur, n)) {
                if (cur.list == null) throw wrongType(k);
                grown.addAll(cur.list);
                exp = cur.expAtMillis;
            }
            grown.add(value.clone());
            return new Entry(null, Collections.unmodifiableList(grown), exp);
        });
        return next.list.size();
    }

    @Override
    public List<byte[]> lrange(String key, long start, long stop) {
        final Entry e = live(key);
        if (e == null) return Collections.emptyList();
        if (e.list == null) throw wrongType(key);
        final int size = e.list.size();
        long from = start < 0 ? size + start : start;
        long to = stop < 0 ? size + stop : stop;
        from = Math.max(0, from);
        to = Math.min(size - 1L, to);
        if (from > to) return Collections.emptyList();
        final List<byte[]> out = new ArrayList<>();
        for (int i = (int) from; i <= (int) to; i++) out.add(e.list.get(i).clone());
        return out;
    }

    @Override
    public boolean exists(String key) {
        return live(key) != null;
    }

    @Override
    public OptionalLong ttl(String key) {
        final Entry e = live(key);
        if (e == null || e.expAtMillis == 0L) return OptionalLong.empty();
        final long remainingMs = e.expAtMillis - now();
        // round up like Redis does for sub-second remainders
        return OptionalLong.of((remainingMs + 999L) / 1000L);
    }

    @Override
    public long delete(String... keys) {
        long n = 0;
        if (keys == null) return n;
        for (String key : keys) {
            if (live(key) != null && map.remove(key) != null) n++;
        }
        return n;
    }

    @Override
    public Set<String> keys(String pattern) {
        final Pattern p = globToRegex(pattern);
        final Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, Entry> e : map.entrySet()) {
            if (p.matcher(e.getKey()).matches() && live(e.getKey()) != null) out.add(e.getKey());
        }
        return out;
    }

    @Override
    public void flushDb() {
        map.clear();
    }

    /**
     * Redis glob syntax: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]} and {@code \\x} escapes.
     * An unterminated or empty {@code [} matches itself.
     */
    static Pattern globToRegex(String glob) {
        final StringBuilder sb = new StringBuilder();
        final int len = glob.length();
        for (int i = 0; i < len; i++) {
            final char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '\\' -> {
                    if (i + 1 < len) i++;
                    sb.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                }
                case '[' -> {
                    final int close = glob.indexOf(']', i + 1);
                    if (close < 0 || close == i + 1) {
                        sb.append(Pattern.quote("["));
                        break;
                    }
                    sb.append('[');
                    int j = i + 1;
                    if (j < close && glob.charAt(j) == '^') {
                        sb.append('^');
                        j++;
                    }
                    for (; j < close; j++) {
                        final char cc = glob.charAt(j);
                        if (cc == '\\' && j + 1 < close) {
                            classLiteral(sb, glob.charAt(++j));
                        } else if (cc == '-') {
                            sb.append('-');
                        } else {
                            classLiteral(sb, cc);
                        }
                    }
                    sb.append(']');
                    i = close;
                }
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    // literal character inside a regex class
    private static void classLiteral(StringBuilder sb, char c) {
        if ("\\[]^-&".indexOf(c) >= 0) sb.append('\\');
        sb.append(c);
    }

    private static byte[] ascii(long v) {
        return Long.toString(v).getBytes(StandardCharsets.US_ASCII);
    }

    private static BackendUnavailableException wrongType(String key) {
        return new BackendUnavailableException("WRONGTYPE Operation against a key holding the wrong kind of value: " + key);
    }
}
