package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Immutable record of one finished voice session.
 *
 * The natural key (user, guild, resource, start time) is unique so a
 * replayed session is detected and skipped instead of double counted.
 *
 * Indexing Strategy:
 * - Unique (user_id, guild_id, resource_id, start_time) for replay detection
 * - (guild_id, activity_date) for per-guild day scans
 */
@Entity
@Table(name = "activity_sessions",
        uniqueConstraints = @UniqueConstraint(name = "uk_session_natural_key",
                columnNames = {"user_id", "guild_id", "resource_id", "start_time"}),
        indexes = {
                @Index(name = "idx_session_guild_date", columnList = "guild_id,activity_date"),
                @Index(name = "idx_session_user", columnList = "user_id,guild_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletedSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "resource_id", nullable = false, length = 32)
    private String resourceId;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "activity_date", nullable = false)
    private LocalDate activityDate;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
