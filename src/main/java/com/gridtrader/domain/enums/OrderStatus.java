package com.gridtrader.domain.enums;

/**
 * Lifecycle status of a grid order as recorded in the state store.
 * Values mirror Bybit's orderStatus field (New, PartiallyFilled, Filled, Cancelled, Rejected).
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public static OrderStatus fromExchange(String value) {
        if (value == null) {
            return NEW;
        }
        switch (value) {
            case "PartiallyFilled":
                return PARTIALLY_FILLED;
            case "Filled":
                return FILLED;
            case "Cancelled":
            case "PartiallyFilledCanceled":
            case "Deactivated":
                return CANCELLED;
            case "Rejected":
                return REJECTED;
            default:
                return NEW;
        }
    }
}
