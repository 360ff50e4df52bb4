package com.kvtrack.cache.config;

import com.kvtrack.cache.backend.KeyValueBackend;
import com.kvtrack.cache.backend.RedisKeyValueBackend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

@Configuration
@ConditionalOnProperty(name = "kv.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisConfig {

    // host/port come from spring.data.redis.* via Boot's Lettuce connection factory
    @Bean
    public RedisTemplate<String, byte[]> byteRedisTemplate(RedisConnectionFactory cf) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(cf);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashKeySerializer(RedisSerializer.string());
        template.setHashValueSerializer(RedisSerializer.byteArray());
        return template;
    }

    @Bean
    public KeyValueBackend keyValueBackend(RedisTemplate<String, byte[]> byteRedisTemplate,
                                           @Value("${kv.redis.key-prefix:}") String keyPrefix) {
        return new RedisKeyValueBackend(byteRedisTemplate, keyPrefix);
    }
}
