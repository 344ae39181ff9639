package com.voiceactivity.domain.model;

public enum TransitionType {
    JOIN,
    LEAVE,
    MOVE,
    NO_OP
}
