package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-user per-day rollup. Only grows within a day, except on explicit reset.
 */
@Entity
@Table(name = "user_daily_activity",
        uniqueConstraints = @UniqueConstraint(name = "uk_daily_user_date",
                columnNames = {"user_id", "guild_id", "activity_date"}),
        indexes = @Index(name = "idx_daily_guild_date", columnList = "guild_id,activity_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyActivityEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "activity_date", nullable = false)
    private LocalDate activityDate;

    @Column(name = "total_time_ms", nullable = false)
    private long totalTimeMs;

    @Column(name = "session_count", nullable = false)
    private int sessionCount;

    @Column(name = "first_activity_time")
    private Instant firstActivityTime;

    @Column(name = "last_activity_time")
    private Instant lastActivityTime;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "resources_visited", columnDefinition = "TEXT")
    @Builder.Default
    private Set<String> resourcesVisited = new TreeSet<>();

    @Column(name = "longest_session_ms", nullable = false)
    private long longestSessionMs;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
