package com.kvtrack.cache.fetch;

import com.kvtrack.cache.common.constants.CacheConsts;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * How a resource identifier maps to backend keys. Entries written under one scheme are invisible under another,
 * so a deployment must keep the same scheme.
 */
public enum CacheKeyScheme {

    /**
     * Entry under the identifier itself, counter under "count:" + identifier.
     */
    RAW {
        @Override
        public String cacheKey(String resource) {
            return resource;
        }

        @Override
        public String countKey(String resource) {
            return CacheConsts.Keys.COUNT_PREFIX + resource;
        }
    },

    PREFIXED {
        @Override
        public String cacheKey(String resource) {
            return CacheConsts.Keys.CACHED_PREFIX + resource;
        }

        @Override
        public String countKey(String resource) {
            return CacheConsts.Keys.COUNT_PREFIX + resource;
        }
    },

    /**
     * "cached:" / "count:" + hex SHA-256 of the UTF-8 identifier. Bounded length, no odd characters.
     */
    HASHED {
        @Override
        public String cacheKey(String resource) {
            return CacheConsts.Keys.CACHED_PREFIX + sha256Hex(resource);
        }

        @Override
        public String countKey(String resource) {
            return CacheConsts.Keys.COUNT_PREFIX + sha256Hex(resource);
        }
    };

    public abstract String cacheKey(String resource);

    public abstract String countKey(String resource);

    /**
     * Pattern matching every cache entry of this scheme, or null when entries carry no prefix.
     */
    public String cacheKeyPattern() {
        return this == RAW ? null : CacheConsts.Keys.CACHED_PREFIX + "*";
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
