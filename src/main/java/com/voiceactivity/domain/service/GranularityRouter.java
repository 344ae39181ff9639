package com.voiceactivity.domain.service;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the cheapest rollup table for a date range.
 *
 * Span (inclusive days):
 * - up to 7: daily rows
 * - up to 30: full ISO weeks from the weekly table, partial edge weeks from daily rows
 * - over 30: full months from the monthly table, edges planned as above
 *
 * Coarse rows only ever cover periods lying completely inside the range,
 * so every plan sums to exactly the same total as the daily rows would.
 */
@Component
public class GranularityRouter {

    static final int DAILY_MAX_SPAN = 7;
    static final int WEEKLY_MAX_SPAN = 30;

    public List<RangeSegment> plan(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }

        long span = ChronoUnit.DAYS.between(start, end) + 1;
        List<RangeSegment> plan = new ArrayList<>();
        if (span <= DAILY_MAX_SPAN) {
            plan.add(new RangeSegment(Granularity.DAILY, start, end));
        } else if (span <= WEEKLY_MAX_SPAN) {
            planWeekly(start, end, plan);
        } else {
            planMonthly(start, end, plan);
        }
        return plan;
    }

    public Granularity primaryGranularity(LocalDate start, LocalDate end) {
        long span = ChronoUnit.DAYS.between(start, end) + 1;
        if (span <= DAILY_MAX_SPAN) {
            return Granularity.DAILY;
        }
        return span <= WEEKLY_MAX_SPAN ? Granularity.WEEKLY : Granularity.MONTHLY;
    }

    private void planWeekly(LocalDate start, LocalDate end, List<RangeSegment> plan) {
        LocalDate firstMonday = start.with(TemporalAdjusters.nextOrSame(DayOfWeek.MONDAY));
        LocalDate lastSunday = end.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));

        if (firstMonday.plusDays(6).isAfter(end)) {
            plan.add(new RangeSegment(Granularity.DAILY, start, end));
            return;
        }

        if (firstMonday.isAfter(start)) {
            plan.add(new RangeSegment(Granularity.DAILY, start, firstMonday.minusDays(1)));
        }
        plan.add(new RangeSegment(Granularity.WEEKLY, firstMonday, lastSunday.minusDays(6)));
        if (lastSunday.isBefore(end)) {
            plan.add(new RangeSegment(Granularity.DAILY, lastSunday.plusDays(1), end));
        }
    }

    private void planMonthly(LocalDate start, LocalDate end, List<RangeSegment> plan) {
        LocalDate firstMonth = start.getDayOfMonth() == 1 ? start : start.with(TemporalAdjusters.firstDayOfNextMonth());
        LocalDate lastMonthEnd = end.equals(end.with(TemporalAdjusters.lastDayOfMonth()))
                ? end
                : end.with(TemporalAdjusters.firstDayOfMonth()).minusDays(1);

        if (firstMonth.isAfter(lastMonthEnd)) {
            planWeekly(start, end, plan);
            return;
        }

        if (firstMonth.isAfter(start)) {
            planWeekly(start, firstMonth.minusDays(1), plan);
        }
        plan.add(new RangeSegment(Granularity.MONTHLY, firstMonth, lastMonthEnd.with(TemporalAdjusters.firstDayOfMonth())));
        if (lastMonthEnd.isBefore(end)) {
            planWeekly(lastMonthEnd.plusDays(1), end, plan);
        }
    }
}
