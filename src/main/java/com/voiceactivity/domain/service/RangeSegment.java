package com.voiceactivity.domain.service;

import lombok.Value;

import java.time.LocalDate;

/**
 * One piece of a query plan.
 *
 * For DAILY the bounds are days; for WEEKLY they are the Mondays of the first
 * and last full week; for MONTHLY the first days of the first and last full month.
 * Both bounds are inclusive.
 */
@Value
public class RangeSegment {

    Granularity granularity;
    LocalDate from;
    LocalDate to;
}
