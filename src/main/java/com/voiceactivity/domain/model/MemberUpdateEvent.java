package com.voiceactivity.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Display name change of a member, possibly while connected to a resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberUpdateEvent {

    @NotBlank
    private String userId;

    @NotBlank
    private String guildId;

    private String oldDisplayName;
    private String newDisplayName;
    private String currentResourceId;
    private Instant timestamp;
}
