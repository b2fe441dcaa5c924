package com.gridtrader.domain.enums;

import java.time.Duration;

/** Reporting windows for P&L summaries. */
public enum PnlPeriod {
    LAST_24H("24h", Duration.ofHours(24)),
    LAST_7D("7d", Duration.ofDays(7)),
    LAST_30D("30d", Duration.ofDays(30));

    private final String label;
    private final Duration window;

    PnlPeriod(String label, Duration window) {
        this.label = label;
        this.window = window;
    }

    public String getLabel() {
        return label;
    }

    public Duration getWindow() {
        return window;
    }

    /** Parses "24h" / "7d" / "30d"; anything else falls back to 24h. */
    public static PnlPeriod fromLabel(String label) {
        for (PnlPeriod period : values()) {
            if (period.label.equalsIgnoreCase(label)) {
                return period;
            }
        }
        return LAST_24H;
    }
}
