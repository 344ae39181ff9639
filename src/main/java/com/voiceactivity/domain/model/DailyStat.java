package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStat {

    private LocalDate date;
    private long activeUsers;
    private long totalTimeMs;
    private long averageTimeMs;
}
