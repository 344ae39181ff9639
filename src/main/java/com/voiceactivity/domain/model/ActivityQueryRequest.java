package com.voiceactivity.domain.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Batch activity lookup for many users over one date range (inclusive).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityQueryRequest {

    @NotEmpty
    private List<String> userIds;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;
}
