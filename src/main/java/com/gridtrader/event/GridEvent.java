package com.gridtrader.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the grid engine and fill monitor on ladder and fill changes.
 */
public class GridEvent extends ApplicationEvent {

    private final GridEventType eventType;
    private final String message;
    private final int orderCount;

    public GridEvent(Object source, GridEventType eventType, String message, int orderCount) {
        super(source);
        this.eventType = eventType;
        this.message = message;
        this.orderCount = orderCount;
    }

    public GridEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }

    /** Orders placed for GRID_BUILT, fills for FILL_PROCESSED, otherwise 0. */
    public int getOrderCount() {
        return orderCount;
    }
}
