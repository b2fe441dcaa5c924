package com.gridtrader.event;

public enum GridEventType {

    /** A ladder was computed and placed (initial setup or recenter). */
    GRID_BUILT,

    /** A recenter completed. */
    RECENTERED,

    /** A recenter could not rebuild the ladder. */
    RECENTER_FAILED,

    /** A new execution was persisted by the fill monitor. */
    FILL_PROCESSED
}
