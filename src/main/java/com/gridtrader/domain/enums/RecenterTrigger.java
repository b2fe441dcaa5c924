package com.gridtrader.domain.enums;

/**
 * Conditions that cause a grid recenter, in evaluation priority order.
 * The first satisfied condition wins.
 */
public enum RecenterTrigger {
    NO_ACTIVE_ORDERS,
    BAND_DEVIATION,
    TIME_BASED,
    ONE_SIDED,
    PUMP_DUMP
}
