package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

@Entity
@Table(name = "guild_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuildSettingsEntity {

    @Id
    @Column(name = "guild_id", length = 32)
    private String guildId;

    /** Not tracked and not logged. */
    @Convert(converter = StringSetConverter.class)
    @Column(name = "fully_excluded_resources", columnDefinition = "TEXT")
    @Builder.Default
    private Set<String> fullyExcludedResources = new TreeSet<>();

    /** Logged but never accrues time. */
    @Convert(converter = StringSetConverter.class)
    @Column(name = "activity_limited_resources", columnDefinition = "TEXT")
    @Builder.Default
    private Set<String> activityLimitedResources = new TreeSet<>();

    @Column(name = "activity_threshold_hours")
    private Integer activityThresholdHours;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
