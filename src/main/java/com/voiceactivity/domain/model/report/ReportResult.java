package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Terminal outcome. For ERROR and CANCELLED, {@code users} holds what was
 * computed before the operation stopped and {@code complete} is false.
 * A COMPLETED report that skipped failed batches is {@code degraded}, lists the
 * members it left out in {@code skippedUserIds}, and is not complete either.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportResult {

    private String operationId;
    private String guildId;
    private String roleFilter;
    private LocalDate startDate;
    private LocalDate endDate;
    private ReportStage stage;
    private boolean complete;
    private boolean degraded;

    @Builder.Default
    private List<String> skippedUserIds = new ArrayList<>();

    private boolean fromCache;
    private ClassifiedUsers users;
    private ReportStatistics statistics;
    private ReportError error;
    private Instant generatedAt;
}
