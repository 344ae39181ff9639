package com.voiceactivity.domain.model.report;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Report over members of a guild, optionally restricted to one role.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRequest {

    @NotBlank
    private String guildId;

    /** Role name; null reports on every member. */
    private String roleFilter;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;

    @Valid
    private ReportConfig config;
}
