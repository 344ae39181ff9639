package com.voiceactivity.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Typed JSON cache over the {@link CacheStore}.
 *
 * TTLs by kind:
 * - Live activity snapshots: 5 minutes
 * - Guild settings and role rules: 10 minutes
 * - Rendered reports: 2 to 6 hours
 * - Active sessions: 24 hours
 *
 * An unreadable entry is logged, deleted and reported as a miss.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityCacheService {

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;

    public <T> Optional<T> get(String key, Class<T> type) {
        return cacheStore.get(key).flatMap(json -> read(key, json, type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return cacheStore.get(key).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, type));
            } catch (JsonProcessingException e) {
                return discard(key, e);
            }
        });
    }

    public void set(String key, Object value, Duration ttl) {
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("Cached {} (TTL: {}s)", key, ttl.toSeconds());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize value for {}: {}", key, e.getMessage());
        }
    }

    public void invalidate(String key) {
        cacheStore.delete(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    public Set<String> keys(String prefix) {
        return cacheStore.keys(prefix);
    }

    /**
     * Joins the prefix and parameters with ':'; null parameters become "null".
     */
    public String generateCacheKey(String prefix, Object... params) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object param : params) {
            key.append(":").append(param != null ? param.toString() : "null");
        }
        return key.toString();
    }

    private <T> Optional<T> read(String key, String json, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            return discard(key, e);
        }
    }

    private <T> Optional<T> discard(String key, JsonProcessingException e) {
        log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
        cacheStore.delete(key);
        return Optional.empty();
    }
}
