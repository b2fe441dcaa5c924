package com.gridtrader.domain.enums;

/** Types of events written to the state store's event log. */
public enum BotEventType {

    /** Initial ladder built and placed. */
    GRID_SETUP,

    /** A recenter was triggered. */
    RECENTER,

    /** A recenter or setup could not rebuild the ladder. */
    RECENTER_FAILED,

    /** Drawdown latch fired. */
    KILL_SWITCH,

    /** Kill switch cleared by an operator. */
    KILL_SWITCH_DEACTIVATED,

    /** Position exposure above the configured cap. */
    MAX_EXPOSURE,

    /** Active grid profile changed. */
    PROFILE_CHANGED,

    /** Trading loops started or stopped. */
    LIFECYCLE
}
