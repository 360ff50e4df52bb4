package com.kvtrack.cache.backend;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the backend against a real Redis. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisKeyValueBackendContainerTest {

    // Redis 7-alpine is lightweight
    @Container
    static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    static LettuceConnectionFactory factory;
    RedisKeyValueBackend backend;

    @BeforeAll
    static void connect() {
        factory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        factory.afterPropertiesSet();
    }

    @AfterAll
    static void disconnect() {
        factory.destroy();
    }

    @BeforeEach
    void setUp() {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(factory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        backend = new RedisKeyValueBackend(template, "");
        backend.flushDb();
    }

    @Test
    void setGetAndExists() {
        backend.set("k", "hello".getBytes(StandardCharsets.UTF_8));

        assertThat(backend.get("k")).hasValueSatisfying(v -> assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("hello"));
        assertThat(backend.exists("k")).isTrue();
        assertThat(backend.get("missing")).isEmpty();
    }

    @Test
    void incrAndListsBehaveLikeRedis() {
        assertThat(backend.incr("Cache.store")).isEqualTo(1L);
        assertThat(backend.incr("Cache.store")).isEqualTo(2L);

        backend.rpush("Cache.store:inputs", "[\"first\"]".getBytes(StandardCharsets.UTF_8));
        backend.rpush("Cache.store:inputs", "[\"second\"]".getBytes(StandardCharsets.UTF_8));
        assertThat(backend.lrange("Cache.store:inputs", 0, -1).stream()
                .map(v -> new String(v, StandardCharsets.UTF_8))
                .collect(Collectors.toList()))
                .containsExactly("[\"first\"]", "[\"second\"]");
    }

    @Test
    void setexCarriesTtlAndKeysFindsEntries() {
        backend.setex("cached:abc", Duration.ofSeconds(30), "page".getBytes(StandardCharsets.UTF_8));

        assertThat(backend.ttl("cached:abc")).isPresent();
        assertThat(backend.ttl("cached:abc").getAsLong()).isBetween(1L, 30L);
        assertThat(backend.keys("cached:*")).containsExactly("cached:abc");
        assertThat(backend.delete("cached:abc")).isEqualTo(1L);
        assertThat(backend.exists("cached:abc")).isFalse();
    }
}
