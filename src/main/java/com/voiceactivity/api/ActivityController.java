package com.voiceactivity.api;

import com.voiceactivity.domain.model.ActivityQueryRequest;
import com.voiceactivity.domain.model.ActivityQueryResponse;
import com.voiceactivity.domain.model.DailyStat;
import com.voiceactivity.domain.service.ActivityAggregationService;
import com.voiceactivity.domain.service.ActivityQueryService;
import com.voiceactivity.domain.service.LiveActivityService;
import com.voiceactivity.domain.service.ReportCacheService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Historical activity queries.
 *
 * Endpoints:
 * - GET /api/v1/guilds/{guildId}/users/{userId}/activity?start=&end= - One user's total
 * - POST /api/v1/guilds/{guildId}/activity/batch - Totals for many users
 * - GET /api/v1/guilds/{guildId}/activity/daily?start=&end= - Per-day guild totals
 * - DELETE /api/v1/guilds/{guildId}/users/{userId}/activity - Reset one user
 *
 * Dates are ISO-8601 (yyyy-MM-dd) and both bounds are inclusive.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/guilds/{guildId}")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityQueryService queryService;
    private final ActivityAggregationService aggregationService;
    private final LiveActivityService liveActivityService;
    private final ReportCacheService reportCacheService;

    @GetMapping("/users/{userId}/activity")
    public ResponseEntity<Map<String, Object>> getUserActivity(
            @PathVariable String guildId,
            @PathVariable String userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        log.info("User activity: guild={}, user={}, {}..{}", guildId, userId, start, end);
        long total = queryService.getUserActivity(userId, guildId, start, end);
        return ResponseEntity.ok(Map.of(
                "userId", userId,
                "guildId", guildId,
                "startDate", start,
                "endDate", end,
                "totalTimeMs", total));
    }

    @PostMapping("/activity/batch")
    public ResponseEntity<ActivityQueryResponse> getBatchActivity(
            @PathVariable String guildId,
            @Valid @RequestBody ActivityQueryRequest request) {

        log.info("Batch activity: guild={}, users={}, {}..{}",
                guildId, request.getUserIds().size(), request.getStartDate(), request.getEndDate());

        long started = System.currentTimeMillis();
        Map<String, Long> totals = queryService.getBatchActivity(
                request.getUserIds(), guildId, request.getStartDate(), request.getEndDate());

        return ResponseEntity.ok(ActivityQueryResponse.builder()
                .guildId(guildId)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .totals(totals)
                .queryTimeMs(System.currentTimeMillis() - started)
                .build());
    }

    @GetMapping("/activity/daily")
    public ResponseEntity<List<DailyStat>> getDailyStats(
            @PathVariable String guildId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        log.info("Daily stats: guild={}, {}..{}", guildId, start, end);
        return ResponseEntity.ok(queryService.getDailyStats(guildId, start, end));
    }

    @DeleteMapping("/users/{userId}/activity")
    public ResponseEntity<Map<String, Object>> resetUserActivity(
            @PathVariable String guildId,
            @PathVariable String userId) {

        log.info("Reset activity: guild={}, user={}", guildId, userId);
        long removed = aggregationService.resetUserActivity(userId, guildId);
        liveActivityService.invalidate(userId, guildId);
        reportCacheService.invalidateGuild(guildId);
        return ResponseEntity.ok(Map.of("userId", userId, "sessionsRemoved", removed));
    }
}
