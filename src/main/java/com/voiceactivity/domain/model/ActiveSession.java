package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * In-progress session. At most one per (user, guild).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveSession {

    private String userId;
    private String guildId;
    private String resourceId;
    private Instant startTime;
    private String displayName;
}
