package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Calendar month rollup keyed by the first day of the month.
 */
@Entity
@Table(name = "user_monthly_activity",
        uniqueConstraints = @UniqueConstraint(name = "uk_monthly_user_month",
                columnNames = {"user_id", "guild_id", "activity_month"}),
        indexes = @Index(name = "idx_monthly_guild_month", columnList = "guild_id,activity_month"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyActivityEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "activity_month", nullable = false)
    private LocalDate activityMonth;

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
