package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.CompletedSession;
import com.voiceactivity.infrastructure.persistence.entity.CompletedSessionEntity;
import com.voiceactivity.infrastructure.persistence.entity.DailyActivityEntity;
import com.voiceactivity.infrastructure.persistence.repository.CompletedSessionRepository;
import com.voiceactivity.infrastructure.persistence.repository.DailyActivityRepository;
import com.voiceactivity.infrastructure.persistence.repository.MonthlyActivityRepository;
import com.voiceactivity.infrastructure.persistence.repository.WeeklyActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.TreeSet;

/**
 * Write side of the tiered store.
 *
 * Write Flow:
 * 1. Skip the session if its natural key was already recorded (replay)
 * 2. Insert the immutable session row
 * 3. Add it to the daily row of its start date
 * 4. Recompute the owning week and month from daily rows
 *
 * Steps 2 to 4 share one transaction. Callers serialize writes per user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityAggregationService {

    private final CompletedSessionRepository sessionRepository;
    private final DailyActivityRepository dailyRepository;
    private final WeeklyActivityRepository weeklyRepository;
    private final MonthlyActivityRepository monthlyRepository;
    private final RollupRecomputer rollupRecomputer;
    private final AppProperties properties;

    /**
     * @return false when the session had already been recorded
     */
    @Transactional
    public boolean recordCompletedSession(CompletedSession session) {
        validate(session);

        if (sessionRepository.existsByUserIdAndGuildIdAndResourceIdAndStartTime(
                session.getUserId(), session.getGuildId(), session.getResourceId(), session.getStartTime())) {
            log.info("Skipping replayed session: user={}, guild={}, resource={}, start={}",
                    session.getUserId(), session.getGuildId(), session.getResourceId(), session.getStartTime());
            return false;
        }

        LocalDate day = LocalDate.ofInstant(session.getStartTime(), properties.zone());

        sessionRepository.save(CompletedSessionEntity.builder()
                .userId(session.getUserId())
                .guildId(session.getGuildId())
                .resourceId(session.getResourceId())
                .displayName(session.getDisplayName())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .durationMs(session.getDurationMs())
                .activityDate(day)
                .build());

        DailyActivityEntity daily = dailyRepository
                .findByUserIdAndGuildIdAndActivityDate(session.getUserId(), session.getGuildId(), day)
                .orElseGet(() -> DailyActivityEntity.builder()
                        .userId(session.getUserId())
                        .guildId(session.getGuildId())
                        .activityDate(day)
                        .resourcesVisited(new TreeSet<>())
                        .build());

        daily.setTotalTimeMs(daily.getTotalTimeMs() + session.getDurationMs());
        daily.setSessionCount(daily.getSessionCount() + 1);
        daily.setFirstActivityTime(earliest(daily.getFirstActivityTime(), session.getStartTime()));
        daily.setLastActivityTime(latest(daily.getLastActivityTime(), session.getEndTime()));
        daily.getResourcesVisited().add(session.getResourceId());
        daily.setLongestSessionMs(Math.max(daily.getLongestSessionMs(), session.getDurationMs()));
        dailyRepository.save(daily);

        rollupRecomputer.afterDailyWrite(session.getUserId(), session.getGuildId(), day);

        log.debug("Recorded session for user {} in guild {}: {} ms on {}",
                session.getUserId(), session.getGuildId(), session.getDurationMs(), day);
        return true;
    }

    /**
     * Explicit reset: the only path that lowers a user's totals.
     *
     * @return number of raw sessions removed
     */
    @Transactional
    public long resetUserActivity(String userId, String guildId) {
        long sessions = sessionRepository.deleteByUserIdAndGuildId(userId, guildId);
        long days = dailyRepository.deleteByUserIdAndGuildId(userId, guildId);
        weeklyRepository.deleteByUserIdAndGuildId(userId, guildId);
        monthlyRepository.deleteByUserIdAndGuildId(userId, guildId);
        log.info("Reset activity for user {} in guild {}: {} sessions, {} days removed", userId, guildId, sessions, days);
        return sessions;
    }

    private void validate(CompletedSession session) {
        if (session.getUserId() == null || session.getGuildId() == null || session.getResourceId() == null) {
            throw new IllegalArgumentException("Session requires user, guild and resource ids");
        }
        if (session.getStartTime() == null || session.getEndTime() == null) {
            throw new IllegalArgumentException("Session requires start and end time");
        }
        if (session.getDurationMs() < 0 || session.getEndTime().isBefore(session.getStartTime())) {
            throw new IllegalArgumentException("Session duration must not be negative");
        }
    }

    private static Instant earliest(Instant current, Instant candidate) {
        return current == null || candidate.isBefore(current) ? candidate : current;
    }

    private static Instant latest(Instant current, Instant candidate) {
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
