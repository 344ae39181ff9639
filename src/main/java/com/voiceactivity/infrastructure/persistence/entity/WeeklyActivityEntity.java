package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * ISO week (Monday to Sunday) rollup, always recomputed from the daily rows.
 */
@Entity
@Table(name = "user_weekly_activity",
        uniqueConstraints = @UniqueConstraint(name = "uk_weekly_user_week",
                columnNames = {"user_id", "guild_id", "week_start"}),
        indexes = @Index(name = "idx_weekly_guild_week", columnList = "guild_id,week_start"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyActivityEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "week_end", nullable = false)
    private LocalDate weekEnd;

    @Column(name = "total_time_ms", nullable = false)
    private long totalTimeMs;

    @Column(name = "active_days", nullable = false)
    private int activeDays;

    @Column(name = "session_count", nullable = false)
    private int sessionCount;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
