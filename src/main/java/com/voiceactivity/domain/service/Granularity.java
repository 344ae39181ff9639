package com.voiceactivity.domain.service;

public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY
}
