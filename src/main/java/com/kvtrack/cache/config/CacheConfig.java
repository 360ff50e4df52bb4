package com.kvtrack.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvtrack.cache.backend.KeyValueBackend;
import com.kvtrack.cache.fetch.ExpiringFetchCache;
import com.kvtrack.cache.fetch.HttpResourceFetcher;
import com.kvtrack.cache.fetch.ResourceFetcher;
import com.kvtrack.cache.instrument.CallReplayer;
import com.kvtrack.cache.instrument.CallSerializer;
import com.kvtrack.cache.store.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public CallSerializer callSerializer(ObjectMapper mapper) {
        return new CallSerializer(mapper);
    }

    @Bean
    public ObjectStore objectStore(KeyValueBackend backend, CallSerializer serializer, KvCacheProperties props) {
        boolean serialize = props.getInstrumentation().isSerializeCalls();
        log.info("Object store on {} (serialized calls: {})", backend.getClass().getSimpleName(), serialize);
        return new ObjectStore(backend, serializer, serialize);
    }

    @Bean
    public CallReplayer callReplayer(KeyValueBackend backend) {
        return new CallReplayer(backend);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceFetcher resourceFetcher(KvCacheProperties props) {
        KvCacheProperties.Fetch f = props.getFetch();
        return new HttpResourceFetcher(f.getConnectTimeout(), f.getRequestTimeout());
    }

    @Bean
    public ExpiringFetchCache expiringFetchCache(KeyValueBackend backend, ResourceFetcher fetcher,
                                                 KvCacheProperties props) {
        KvCacheProperties.Fetch f = props.getFetch();
        log.info("Fetch cache: key scheme {}, count policy {}, default expire {}",
                f.getKeyScheme(), f.getCountPolicy(), f.getDefaultExpire());
        return new ExpiringFetchCache(backend, fetcher, f.getKeyScheme(), f.getCountPolicy(), f.getDefaultExpire());
    }
}
