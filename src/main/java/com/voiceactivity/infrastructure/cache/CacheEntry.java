package com.voiceactivity.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Entry held by the in-process store. Never authoritative.
 */
@Data
@AllArgsConstructor
public class CacheEntry {

    private String key;
    private String value;
    private Instant insertedAt;
    private long ttlSeconds;

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }
}
