package com.gridtrader.grid;

import com.gridtrader.domain.enums.RecenterTrigger;

/** Whether the ladder should be rebuilt and, if so, which condition fired. */
public record RecenterDecision(boolean triggered, RecenterTrigger trigger, String reason) {

    private static final RecenterDecision NONE = new RecenterDecision(false, null, "");

    public static RecenterDecision none() {
        return NONE;
    }

    public static RecenterDecision of(RecenterTrigger trigger, String reason) {
        return new RecenterDecision(true, trigger, reason);
    }
}
