package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.DailyStat;
import com.voiceactivity.infrastructure.persistence.repository.DailyActivityRepository;
import com.voiceactivity.infrastructure.persistence.repository.MonthlyActivityRepository;
import com.voiceactivity.infrastructure.persistence.repository.WeeklyActivityRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the tiered store.
 *
 * Query Flow:
 * 1. Ask the {@link GranularityRouter} for a plan over the date range
 * 2. Sum each segment from its rollup table
 * 3. Batch lookups run one grouped query per segment for all users
 *
 * A failing grouped query degrades to sequential per-user queries so a
 * report never fails because of the optimized path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityQueryService {

    private final DailyActivityRepository dailyRepository;
    private final WeeklyActivityRepository weeklyRepository;
    private final MonthlyActivityRepository monthlyRepository;
    private final GranularityRouter router;
    private final MeterRegistry meterRegistry;
    private final AppProperties properties;

    /**
     * Total milliseconds for one user over an inclusive date range.
     */
    @Transactional(readOnly = true, timeout = 10)
    public long getUserActivity(String userId, String guildId, LocalDate start, LocalDate end) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<RangeSegment> plan = router.plan(start, end);

        long total = 0;
        for (RangeSegment segment : plan) {
            total += sumSegment(userId, guildId, segment);
        }

        sample.stop(Timer.builder("activity.query.latency")
                .tag("type", "user")
                .tag("granularity", router.primaryGranularity(start, end).name())
                .register(meterRegistry));
        return total;
    }

    /**
     * Instant bounds are mapped to calendar days in the configured zone.
     */
    @Transactional(readOnly = true, timeout = 10)
    public long getUserActivity(String userId, String guildId, Instant start, Instant end) {
        return getUserActivity(userId, guildId, toDay(start), toDay(end));
    }

    /**
     * Totals for many users at once; users with no rows map to 0.
     * Runs without a surrounding transaction so a failed grouped query
     * cannot mark the per-user fallback for rollback.
     */
    public Map<String, Long> getBatchActivity(Collection<String> userIds, String guildId, LocalDate start, LocalDate end) {
        Map<String, Long> totals = new LinkedHashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return totals;
        }
        userIds.forEach(userId -> totals.put(userId, 0L));
        List<RangeSegment> plan = router.plan(start, end);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<String> ids = new ArrayList<>(totals.keySet());
            for (RangeSegment segment : plan) {
                for (Object[] row : sumSegmentByUser(ids, guildId, segment)) {
                    String userId = (String) row[0];
                    long segmentTotal = row[1] == null ? 0L : ((Number) row[1]).longValue();
                    totals.merge(userId, segmentTotal, Long::sum);
                }
            }

            sample.stop(Timer.builder("activity.query.latency")
                    .tag("type", "batch")
                    .tag("granularity", router.primaryGranularity(start, end).name())
                    .register(meterRegistry));

            Counter.builder("activity.query.executed")
                    .tag("type", "batch")
                    .register(meterRegistry)
                    .increment();

            log.debug("Batch activity for {} users in guild {} ({} to {})", ids.size(), guildId, start, end);
            return totals;

        } catch (RuntimeException e) {
            log.warn("Grouped activity query failed for guild {}, falling back to per-user queries: {}",
                    guildId, e.getMessage());

            Counter.builder("activity.query.fallback")
                    .tag("type", "batch")
                    .register(meterRegistry)
                    .increment();

            return getBatchActivitySequential(totals.keySet(), guildId, start, end);
        }
    }

    public Map<String, Long> getBatchActivity(Collection<String> userIds, String guildId, Instant start, Instant end) {
        return getBatchActivity(userIds, guildId, toDay(start), toDay(end));
    }

    /**
     * Per-day guild totals for dashboards.
     */
    @Transactional(readOnly = true, timeout = 10)
    public List<DailyStat> getDailyStats(String guildId, LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
        List<DailyStat> stats = new ArrayList<>();
        for (Object[] row : dailyRepository.aggregateByDate(guildId, start, end)) {
            long users = ((Number) row[1]).longValue();
            long total = row[2] == null ? 0L : ((Number) row[2]).longValue();
            stats.add(DailyStat.builder()
                    .date((LocalDate) row[0])
                    .activeUsers(users)
                    .totalTimeMs(total)
                    .averageTimeMs(users == 0 ? 0 : total / users)
                    .build());
        }
        return stats;
    }

    private Map<String, Long> getBatchActivitySequential(Collection<String> userIds, String guildId,
                                                         LocalDate start, LocalDate end) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (String userId : userIds) {
            try {
                totals.put(userId, getUserActivity(userId, guildId, start, end));
            } catch (RuntimeException e) {
                log.error("Activity query failed for user {} in guild {}, reporting 0: {}", userId, guildId, e.getMessage());
                totals.put(userId, 0L);
            }
        }
        return totals;
    }

    private long sumSegment(String userId, String guildId, RangeSegment segment) {
        Long sum = switch (segment.getGranularity()) {
            case DAILY -> dailyRepository.sumTotalTime(userId, guildId, segment.getFrom(), segment.getTo());
            case WEEKLY -> weeklyRepository.sumTotalTime(userId, guildId, segment.getFrom(), segment.getTo());
            case MONTHLY -> monthlyRepository.sumTotalTime(userId, guildId, segment.getFrom(), segment.getTo());
        };
        return sum == null ? 0L : sum;
    }

    private List<Object[]> sumSegmentByUser(List<String> userIds, String guildId, RangeSegment segment) {
        return switch (segment.getGranularity()) {
            case DAILY -> dailyRepository.sumTotalTimeByUser(userIds, guildId, segment.getFrom(), segment.getTo());
            case WEEKLY -> weeklyRepository.sumTotalTimeByUser(userIds, guildId, segment.getFrom(), segment.getTo());
            case MONTHLY -> monthlyRepository.sumTotalTimeByUser(userIds, guildId, segment.getFrom(), segment.getTo());
        };
    }

    private LocalDate toDay(Instant instant) {
        return LocalDate.ofInstant(instant, properties.zone());
    }
}
