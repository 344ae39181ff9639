package com.voiceactivity.domain.service;

import com.voiceactivity.infrastructure.persistence.entity.DailyActivityEntity;
import com.voiceactivity.infrastructure.persistence.entity.MonthlyActivityEntity;
import com.voiceactivity.infrastructure.persistence.entity.WeeklyActivityEntity;
import com.voiceactivity.infrastructure.persistence.repository.DailyActivityRepository;
import com.voiceactivity.infrastructure.persistence.repository.MonthlyActivityRepository;
import com.voiceactivity.infrastructure.persistence.repository.WeeklyActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * Post-write hook for the daily table.
 *
 * Rebuilds the weekly and monthly rows owning a day from that period's
 * daily rows. Full recompute rather than delta so replayed or out-of-order
 * writes converge to the same value.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RollupRecomputer {

    private final DailyActivityRepository dailyRepository;
    private final WeeklyActivityRepository weeklyRepository;
    private final MonthlyActivityRepository monthlyRepository;

    @Transactional
    public void afterDailyWrite(String userId, String guildId, LocalDate day) {
        recomputeWeek(userId, guildId, day);
        recomputeMonth(userId, guildId, day);
    }

    @Transactional
    public void recomputeWeek(String userId, String guildId, LocalDate day) {
        LocalDate weekStart = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate weekEnd = weekStart.plusDays(6);
        List<DailyActivityEntity> days = dailyRepository
                .findByUserIdAndGuildIdAndActivityDateBetween(userId, guildId, weekStart, weekEnd);

        WeeklyActivityEntity week = weeklyRepository
                .findByUserIdAndGuildIdAndWeekStart(userId, guildId, weekStart)
                .orElseGet(() -> WeeklyActivityEntity.builder()
                        .userId(userId)
                        .guildId(guildId)
                        .weekStart(weekStart)
                        .weekEnd(weekEnd)
                        .build());

        if (days.isEmpty()) {
            if (week.getId() != null) {
                weeklyRepository.delete(week);
            }
            return;
        }

        week.setTotalTimeMs(days.stream().mapToLong(DailyActivityEntity::getTotalTimeMs).sum());
        week.setSessionCount(days.stream().mapToInt(DailyActivityEntity::getSessionCount).sum());
        week.setActiveDays((int) days.stream().filter(d -> d.getTotalTimeMs() > 0).count());
        weeklyRepository.save(week);
        log.debug("Recomputed week {} for user {} in guild {}: {} ms", weekStart, userId, guildId, week.getTotalTimeMs());
    }

    @Transactional
    public void recomputeMonth(String userId, String guildId, LocalDate day) {
        LocalDate monthStart = day.with(TemporalAdjusters.firstDayOfMonth());
        LocalDate monthEnd = day.with(TemporalAdjusters.lastDayOfMonth());
        List<DailyActivityEntity> days = dailyRepository
                .findByUserIdAndGuildIdAndActivityDateBetween(userId, guildId, monthStart, monthEnd);

        MonthlyActivityEntity month = monthlyRepository
                .findByUserIdAndGuildIdAndActivityMonth(userId, guildId, monthStart)
                .orElseGet(() -> MonthlyActivityEntity.builder()
                        .userId(userId)
                        .guildId(guildId)
                        .activityMonth(monthStart)
                        .build());

        if (days.isEmpty()) {
            if (month.getId() != null) {
                monthlyRepository.delete(month);
            }
            return;
        }

        month.setTotalTimeMs(days.stream().mapToLong(DailyActivityEntity::getTotalTimeMs).sum());
        month.setSessionCount(days.stream().mapToInt(DailyActivityEntity::getSessionCount).sum());
        month.setActiveDays((int) days.stream().filter(d -> d.getTotalTimeMs() > 0).count());
        monthlyRepository.save(month);
        log.debug("Recomputed month {} for user {} in guild {}: {} ms", monthStart, userId, guildId, month.getTotalTimeMs());
    }
}
