package com.gridtrader.domain.enums;

/** Severity of a persisted bot event. */
public enum EventSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
