package com.kvtrack.cache.store;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A payload accepted by the object store: text, raw bytes, a 64-bit integer or a double.
 * Numbers are kept in their decimal text form, which is how the backend stores them.
 */
@Getter
@EqualsAndHashCode
public final class StoredValue {

    public enum Kind {TEXT, BYTES, INTEGER, FLOAT}

    private final Kind kind;
    @Getter(AccessLevel.NONE)
    private final byte[] payload;

    private StoredValue(Kind kind, byte[] payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static StoredValue text(String value) {
        Objects.requireNonNull(value, "value");
        return new StoredValue(Kind.TEXT, value.getBytes(StandardCharsets.UTF_8));
    }

    public static StoredValue bytes(byte[] value) {
        Objects.requireNonNull(value, "value");
        return new StoredValue(Kind.BYTES, value.clone());
    }

    public static StoredValue integer(long value) {
        return new StoredValue(Kind.INTEGER, Long.toString(value).getBytes(StandardCharsets.UTF_8));
    }

    public static StoredValue floating(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }
        return new StoredValue(Kind.FLOAT, Double.toString(value).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Bytes written to the backend for this value.
     */
    public byte[] encode() {
        return payload.clone();
    }

    /**
     * Natural Java form, used when recording call arguments.
     * Bytes come out as a byte array (base64 in JSON).
     */
    @JsonValue
    public Object toJava() {
        String s = new String(payload, StandardCharsets.UTF_8);
        return switch (kind) {
            case TEXT -> s;
            case BYTES -> payload.clone();
            case INTEGER -> Long.parseLong(s);
            case FLOAT -> Double.parseDouble(s);
        };
    }

    @Override
    public String toString() {
        return kind == Kind.BYTES
                ? "StoredValue(BYTES, " + payload.length + " bytes)"
                : "StoredValue(" + kind + ", " + new String(payload, StandardCharsets.UTF_8) + ")";
    }
}
