package com.voiceactivity.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.report.ReportRequest;
import com.voiceactivity.domain.model.report.ReportResult;
import com.voiceactivity.infrastructure.cache.ActivityCacheService;
import com.voiceactivity.infrastructure.persistence.entity.ReportCacheEntity;
import com.voiceactivity.infrastructure.persistence.repository.ReportCacheRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Memoizes finished reports by (guild, filter, date range).
 *
 * Lookup Flow:
 * 1. Shared cache (report:{guild}:{filter}:{threshold}:{start}:{end})
 * 2. report_cache table, unless the row has expired
 * 3. A table hit is copied back into the shared cache for its remaining lifetime
 *
 * TTL is clamped to the configured 2 to 6 hour window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportCacheService {

    static final String KEY_PREFIX = "report";
    static final String ALL_MEMBERS = "all";
    static final String DEFAULT_THRESHOLD = "default";

    private final ReportCacheRepository repository;
    private final ActivityCacheService cacheService;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;
    private final Clock clock;

    /**
     * The threshold override is part of the key: the same members and range
     * classify differently under a different threshold.
     */
    public String cacheKey(ReportRequest request) {
        return cacheService.generateCacheKey(KEY_PREFIX,
                request.getGuildId(),
                filterKey(request),
                request.getStartDate(),
                request.getEndDate());
    }

    @Transactional(readOnly = true)
    public Optional<ReportResult> find(String cacheKey) {
        Optional<ReportResult> cached = cacheService.get(cacheKey, ReportResult.class);
        if (cached.isPresent()) {
            log.debug("Report cache hit (cache) for {}", cacheKey);
            return cached;
        }

        Instant now = clock.instant();
        Optional<ReportCacheEntity> row = repository.findById(cacheKey).filter(entity -> !entity.isExpired(now));
        if (row.isEmpty()) {
            return Optional.empty();
        }

        try {
            ReportResult result = objectMapper.readValue(row.get().getPayload(), ReportResult.class);
            cacheService.set(cacheKey, result, Duration.between(now, row.get().getExpiresAt()));
            log.debug("Report cache hit (table) for {}", cacheKey);
            return Optional.of(result);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable report cache row {}: {}", cacheKey, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Transactional
    public void save(String cacheKey, ReportRequest request, ReportResult result) {
        Duration ttl = effectiveTtl();
        Instant now = clock.instant();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize report {} for caching: {}", cacheKey, e.getMessage());
            return;
        }

        repository.save(ReportCacheEntity.builder()
                .cacheKey(cacheKey)
                .guildId(request.getGuildId())
                .filterKey(filterKey(request))
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .payload(payload)
                .userCount(result.getUsers() == null ? 0 : result.getUsers().size())
                .generationTimeMs(result.getStatistics() == null ? 0 : result.getStatistics().getProcessingTimeMs())
                .generatedAt(now)
                .expiresAt(now.plus(ttl))
                .build());
        cacheService.set(cacheKey, result, ttl);
        log.info("Cached report {} for {}m", cacheKey, ttl.toMinutes());
    }

    @Transactional
    public void invalidate(String cacheKey) {
        repository.deleteById(cacheKey);
        cacheService.invalidate(cacheKey);
    }

    /**
     * Drops every stored report of a guild, e.g. after a member's activity was reset.
     */
    @Transactional
    public long invalidateGuild(String guildId) {
        long rows = repository.deleteByGuildId(guildId);
        String prefix = cacheService.generateCacheKey(KEY_PREFIX, guildId) + ":";
        cacheService.keys(prefix).forEach(cacheService::invalidate);
        log.info("Invalidated reports for guild {} ({} rows)", guildId, rows);
        return rows;
    }

    /**
     * Removes expired rows; cache entries expire on their own.
     */
    @Scheduled(fixedDelayString = "${app.cache.report-cleanup-interval-ms:3600000}")
    @Transactional
    public int cleanupExpired() {
        int removed = repository.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("Removed {} expired report cache rows", removed);
        }
        return removed;
    }

    static String filterKey(ReportRequest request) {
        String role = request.getRoleFilter() == null ? ALL_MEMBERS : request.getRoleFilter();
        Integer override = request.getConfig() == null ? null : request.getConfig().getMinActivityHours();
        return role + ":" + (override == null ? DEFAULT_THRESHOLD : override + "h");
    }

    Duration effectiveTtl() {
        AppProperties.Cache cache = properties.getCache();
        Duration ttl = cache.getReportTtl();
        if (ttl.compareTo(cache.getReportMinTtl()) < 0) {
            return cache.getReportMinTtl();
        }
        return ttl.compareTo(cache.getReportMaxTtl()) > 0 ? cache.getReportMaxTtl() : ttl;
    }
}
