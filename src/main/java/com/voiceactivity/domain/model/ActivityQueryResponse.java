package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityQueryResponse {

    private String guildId;
    private LocalDate startDate;
    private LocalDate endDate;

    /** userId to total milliseconds; users without activity map to 0. */
    private Map<String, Long> totals;

    private long queryTimeMs;
}
