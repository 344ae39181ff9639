package com.voiceactivity.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed store.
 *
 * Every call goes through the "redis" circuit breaker. Failures are NOT
 * swallowed here: transport errors and {@code CallNotPermittedException}
 * propagate so that {@link FallbackCacheStore} can switch to local memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    @CircuitBreaker(name = "redis")
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    @CircuitBreaker(name = "redis")
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    @CircuitBreaker(name = "redis")
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    /**
     * Uses SCAN rather than KEYS so large keyspaces don't block the server.
     */
    @Override
    @CircuitBreaker(name = "redis")
    public Set<String> keys(String prefix) {
        Set<String> keys = new HashSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(1000).build();
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return null;
        });
        log.debug("Scanned {} keys for prefix {}", keys.size(), prefix);
        return keys;
    }
}
