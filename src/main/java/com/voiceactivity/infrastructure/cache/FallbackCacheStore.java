package com.voiceactivity.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Composes a shared primary store with a local in-process store.
 *
 * Writes go to the primary and are mirrored locally. Reads prefer the
 * primary and fall back to local memory on a miss or failure. A primary
 * failure is logged and never reaches the caller.
 */
@Slf4j
public class FallbackCacheStore implements CacheStore {

    private final CacheStore primary;
    private final CacheStore local;

    public FallbackCacheStore(CacheStore primary, CacheStore local) {
        this.primary = primary;
        this.local = local;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            Optional<String> value = primary.get(key);
            if (value.isPresent()) {
                return value;
            }
        } catch (RuntimeException e) {
            log.warn("Primary cache read failed for {}, using local memory: {}", key, e.getMessage());
        }
        return local.get(key);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            primary.set(key, value, ttl);
        } catch (RuntimeException e) {
            log.warn("Primary cache write failed for {}, keeping local copy only: {}", key, e.getMessage());
        }
        local.set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        try {
            primary.delete(key);
        } catch (RuntimeException e) {
            log.warn("Primary cache delete failed for {}: {}", key, e.getMessage());
        }
        local.delete(key);
    }

    @Override
    public Set<String> keys(String prefix) {
        Set<String> keys = new HashSet<>(local.keys(prefix));
        try {
            keys.addAll(primary.keys(prefix));
        } catch (RuntimeException e) {
            log.warn("Primary cache scan failed for prefix {}, using local keys only: {}", prefix, e.getMessage());
        }
        return keys;
    }
}
