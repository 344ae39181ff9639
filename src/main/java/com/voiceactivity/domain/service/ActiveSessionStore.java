package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.ActiveSession;
import com.voiceactivity.infrastructure.cache.ActivityCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Active sessions keyed by active-session:{guild}:{user}.
 *
 * Stored through the fallback cache, so every write lands in Redis (24h TTL)
 * and in local memory, and a Redis outage only narrows the view to this
 * process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActiveSessionStore {

    static final String KEY_PREFIX = "active-session";

    private final ActivityCacheService cacheService;
    private final AppProperties properties;
    private final Clock clock;

    public Optional<ActiveSession> find(String guildId, String userId) {
        return cacheService.get(key(guildId, userId), ActiveSession.class);
    }

    public void save(ActiveSession session) {
        cacheService.set(key(session.getGuildId(), session.getUserId()), session,
                properties.getTracker().getSessionTtl());
    }

    public void remove(String guildId, String userId) {
        cacheService.invalidate(key(guildId, userId));
    }

    /**
     * Reloads sessions left by a previous process.
     *
     * Sessions older than the staleness bound are treated as abandoned and
     * deleted. The rest are written back with their remaining TTL, which
     * also mirrors them into local memory.
     *
     * @return the sessions kept
     */
    public List<ActiveSession> restore() {
        Duration staleAfter = properties.getTracker().getStaleAfter();
        Duration ttl = properties.getTracker().getSessionTtl();
        List<ActiveSession> restored = new ArrayList<>();
        int discarded = 0;

        for (String key : cacheService.keys(KEY_PREFIX + ":")) {
            Optional<ActiveSession> session = cacheService.get(key, ActiveSession.class);
            if (session.isEmpty() || session.get().getStartTime() == null) {
                cacheService.invalidate(key);
                discarded++;
                continue;
            }

            Duration age = Duration.between(session.get().getStartTime(), clock.instant());
            if (age.compareTo(staleAfter) > 0) {
                log.info("Discarding abandoned session {} (age {}m)", key, age.toMinutes());
                cacheService.invalidate(key);
                discarded++;
                continue;
            }

            Duration remaining = ttl.minus(age.isNegative() ? Duration.ZERO : age);
            cacheService.set(key, session.get(), remaining.isNegative() || remaining.isZero() ? Duration.ofSeconds(1) : remaining);
            restored.add(session.get());
        }

        log.info("Restored {} active sessions, discarded {}", restored.size(), discarded);
        return restored;
    }

    String key(String guildId, String userId) {
        return cacheService.generateCacheKey(KEY_PREFIX, guildId, userId);
    }
}
