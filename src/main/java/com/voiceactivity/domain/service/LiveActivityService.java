package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.ActiveSession;
import com.voiceactivity.domain.model.LiveActivity;
import com.voiceactivity.infrastructure.cache.ActivityCacheService;
import com.voiceactivity.infrastructure.persistence.entity.DailyActivityEntity;
import com.voiceactivity.infrastructure.persistence.repository.DailyActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Today's totals per user, cached for 5 minutes under live-activity:{guild}:{user}.
 *
 * The cached snapshot holds completed sessions only; the running session is
 * added on every read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiveActivityService {

    static final String KEY_PREFIX = "live-activity";

    private final DailyActivityRepository dailyRepository;
    private final ActiveSessionStore sessionStore;
    private final ActivityCacheService cacheService;
    private final AppProperties properties;
    private final Clock clock;

    public LiveActivity getLiveActivity(String userId, String guildId) {
        LocalDate today = LocalDate.now(clock.withZone(properties.zone()));
        LiveActivity snapshot = cacheService.get(key(guildId, userId), LiveActivity.class)
                .filter(cached -> today.equals(cached.getDate()))
                .orElseGet(() -> refresh(userId, guildId));

        Optional<ActiveSession> active = sessionStore.find(guildId, userId);
        if (active.isPresent()) {
            Instant now = clock.instant();
            snapshot.setInSession(true);
            snapshot.setCurrentResourceId(active.get().getResourceId());
            snapshot.setSessionStartTime(active.get().getStartTime());
            snapshot.setCurrentSessionMs(Math.max(0, Duration.between(active.get().getStartTime(), now).toMillis()));
        }
        return snapshot;
    }

    /**
     * Reloads today's snapshot from the daily table and writes it to the cache.
     */
    public LiveActivity refresh(String userId, String guildId) {
        LocalDate today = LocalDate.now(clock.withZone(properties.zone()));
        Optional<DailyActivityEntity> daily = dailyRepository.findByUserIdAndGuildIdAndActivityDate(userId, guildId, today);

        LiveActivity snapshot = LiveActivity.builder()
                .userId(userId)
                .guildId(guildId)
                .date(today)
                .completedTimeMs(daily.map(DailyActivityEntity::getTotalTimeMs).orElse(0L))
                .sessionCount(daily.map(DailyActivityEntity::getSessionCount).orElse(0))
                .build();
        cacheService.set(key(guildId, userId), snapshot, properties.getCache().getLiveActivityTtl());
        log.debug("Refreshed live activity for user {} in guild {}: {} ms", userId, guildId, snapshot.getCompletedTimeMs());
        return snapshot;
    }

    public void invalidate(String userId, String guildId) {
        cacheService.invalidate(key(guildId, userId));
    }

    private String key(String guildId, String userId) {
        return cacheService.generateCacheKey(KEY_PREFIX, guildId, userId);
    }
}
