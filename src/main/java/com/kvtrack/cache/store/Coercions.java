package com.kvtrack.cache.store;

import com.kvtrack.cache.common.exception.ConversionException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Stock coercions for the payload kinds the store accepts.
 */
public final class Coercions {

    public static final Coercion<byte[]> BYTES = byte[]::clone;

    public static final Coercion<String> TEXT = Coercions::decodeUtf8;

    public static final Coercion<Long> INTEGER = raw -> {
        String s = decodeUtf8(raw).trim();
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new ConversionException("Not an integer: '" + s + "'", e);
        }
    };

    public static final Coercion<Double> FLOAT = raw -> {
        String s = decodeUtf8(raw).trim();
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new ConversionException("Not a floating-point number: '" + s + "'", e);
        }
    };

    private Coercions() {
    }

    private static String decodeUtf8(byte[] raw) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ConversionException("Payload is not valid UTF-8", e);
        }
    }
}
