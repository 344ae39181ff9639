package com.voiceactivity.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Bounded in-process store with the same per-entry TTL semantics as Redis.
 * Entries may be evicted early once {@code maximumSize} is reached.
 */
public class LocalCacheStore implements CacheStore {

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public LocalCacheStore(long maximumSize, Clock clock) {
        this(maximumSize, clock, Ticker.systemTicker(), Runnable::run);
    }

    LocalCacheStore(long maximumSize, Clock clock, Ticker ticker, Executor executor) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryTtlExpiry())
                .ticker(ticker)
                .executor(executor)
                .recordStats()
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new CacheEntry(key, value, clock.instant(), Math.max(1, ttl.toSeconds())));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public Set<String> keys(String prefix) {
        return cache.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .collect(Collectors.toSet());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
