package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "role_thresholds",
        uniqueConstraints = @UniqueConstraint(name = "uk_role_threshold",
                columnNames = {"guild_id", "role_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleThresholdEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "role_name", nullable = false, length = 100)
    private String roleName;

    @Column(name = "min_hours", nullable = false)
    private int minHours;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
