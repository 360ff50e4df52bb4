package com.kvtrack.cache.web;

import com.kvtrack.cache.common.exception.ValidationException;
import com.kvtrack.cache.store.StoredValue;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Base64;

/**
 * Body of {@code POST /api/cache}. BYTES values travel base64-encoded.
 */
@Data
@NoArgsConstructor
public class StoreRequest {

    @NotNull
    private StoredValue.Kind kind;

    @NotNull
    private String value;

    public StoredValue toStoredValue() {
        try {
            return switch (kind) {
                case TEXT -> StoredValue.text(value);
                case BYTES -> StoredValue.bytes(Base64.getDecoder().decode(value));
                case INTEGER -> StoredValue.integer(Long.parseLong(value.trim()));
                case FLOAT -> StoredValue.floating(Double.parseDouble(value.trim()));
            };
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            throw new ValidationException("Value does not match kind " + kind + ": " + e.getMessage(), e);
        }
    }
}
