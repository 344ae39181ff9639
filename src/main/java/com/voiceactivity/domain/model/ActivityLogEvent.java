package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Published for every join, leave or move that does not touch only
 * fully-excluded resources. Consumed by the outbound messaging layer.
 */
@Data
@Builder
@AllArgsConstructor
public class ActivityLogEvent {

    private TransitionType type;
    private String userId;
    private String guildId;
    private String displayName;
    private String fromResourceId;
    private String toResourceId;
    private Instant timestamp;

    /** Whether the user accrues time after this transition. */
    private boolean accruing;
}
