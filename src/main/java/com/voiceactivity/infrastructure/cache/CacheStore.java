package com.voiceactivity.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * String key/value store with per-entry TTL.
 *
 * Implemented by Redis (shared across instances) and by an in-process
 * Caffeine map; {@link FallbackCacheStore} composes the two.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * All live keys starting with the given prefix.
     */
    Set<String> keys(String prefix);
}
