package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackerStatistics {

    private long totalJoins;
    private long totalLeaves;
    private int activeSessions;
    private int peakConcurrentSessions;
    private long storeFailures;
}
