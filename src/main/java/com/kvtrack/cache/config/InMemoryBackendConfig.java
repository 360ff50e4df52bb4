package com.kvtrack.cache.config;

import com.kvtrack.cache.backend.InMemoryKeyValueBackend;
import com.kvtrack.cache.backend.KeyValueBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "kv.redis.enabled", havingValue = "false")
public class InMemoryBackendConfig {

    @Bean
    public KeyValueBackend keyValueBackend() {
        return new InMemoryKeyValueBackend();
    }
}
