package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletedSession {

    private String userId;
    private String guildId;
    private String resourceId;
    private String displayName;
    private Instant startTime;
    private Instant endTime;
    private long durationMs;

    /**
     * Closes an active session at {@code endTime}. A clock running backwards yields zero.
     */
    public static CompletedSession close(ActiveSession session, Instant endTime) {
        long duration = Math.max(0, Duration.between(session.getStartTime(), endTime).toMillis());
        return CompletedSession.builder()
                .userId(session.getUserId())
                .guildId(session.getGuildId())
                .resourceId(session.getResourceId())
                .displayName(session.getDisplayName())
                .startTime(session.getStartTime())
                .endTime(endTime.isBefore(session.getStartTime()) ? session.getStartTime() : endTime)
                .durationMs(duration)
                .build();
    }
}
