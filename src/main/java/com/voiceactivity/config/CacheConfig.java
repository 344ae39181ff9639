package com.voiceactivity.config;

import com.voiceactivity.infrastructure.cache.CacheStore;
import com.voiceactivity.infrastructure.cache.FallbackCacheStore;
import com.voiceactivity.infrastructure.cache.LocalCacheStore;
import com.voiceactivity.infrastructure.cache.RedisCacheStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public LocalCacheStore localCacheStore(AppProperties properties, Clock clock) {
        return new LocalCacheStore(properties.getCache().getLocalMaxEntries(), clock);
    }

    /**
     * The store every component should use: Redis first, local memory on failure.
     */
    @Bean
    @Primary
    public CacheStore cacheStore(RedisCacheStore redisCacheStore, LocalCacheStore localCacheStore) {
        return new FallbackCacheStore(redisCacheStore, localCacheStore);
    }
}
