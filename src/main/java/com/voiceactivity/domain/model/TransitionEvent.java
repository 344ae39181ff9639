package com.voiceactivity.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Presence change reported by the platform. A null resource means "not connected".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionEvent {

    @NotBlank
    private String userId;

    @NotBlank
    private String guildId;

    private String oldResourceId;
    private String newResourceId;

    /** Falls back to the service clock when absent. */
    private Instant timestamp;

    private String displayName;
}
