package com.gridtrader.event;

/** Classifies the risk condition behind a {@link RiskEvent}. */
public enum RiskEventType {

    /** Position value over equity exceeded the configured cap. */
    MAX_EXPOSURE_EXCEEDED,

    /** Daily drawdown reached the kill switch threshold. */
    KILL_SWITCH_TRIGGERED,

    /** Kill switch cleared by an operator. */
    KILL_SWITCH_DEACTIVATED
}
