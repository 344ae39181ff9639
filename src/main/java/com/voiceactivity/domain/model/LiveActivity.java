package com.voiceactivity.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Today's activity for one user, including the session still in progress.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class LiveActivity {

    private String userId;
    private String guildId;
    private LocalDate date;

    /** Completed sessions only. */
    private long completedTimeMs;
    private int sessionCount;

    private boolean inSession;
    private String currentResourceId;
    private Instant sessionStartTime;
    private long currentSessionMs;

    public long getTotalTimeMs() {
        return completedTimeMs + currentSessionMs;
    }
}
