package com.voiceactivity.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Local copy of the platform's member directory, refreshed by member sync.
 */
@Entity
@Table(name = "guild_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_guild_member",
                columnNames = {"guild_id", "user_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuildMemberEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "roles", columnDefinition = "TEXT")
    @Builder.Default
    private Set<String> roles = new TreeSet<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
