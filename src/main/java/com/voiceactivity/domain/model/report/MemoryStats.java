package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryStats {

    private long usedBytes;
    private long peakBytes;
    private long cleanupThresholdBytes;
    private long maxBytes;
    private long cleanupsPerformed;
}
