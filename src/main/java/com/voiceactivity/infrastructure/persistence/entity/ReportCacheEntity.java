package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Rendered report payload memoized by (guild, role filter and threshold override, date range).
 * Rows past {@code expiresAt} are ignored and removed by a scheduled sweep.
 */
@Entity
@Table(name = "report_cache", indexes = {
        @Index(name = "idx_report_cache_expires", columnList = "expires_at"),
        @Index(name = "idx_report_cache_guild", columnList = "guild_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportCacheEntity {

    @Id
    @Column(name = "cache_key", length = 255)
    private String cacheKey;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "filter_key", length = 100)
    private String filterKey;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "user_count", nullable = false)
    private int userCount;

    @Column(name = "generation_time_ms", nullable = false)
    private long generationTimeMs;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
