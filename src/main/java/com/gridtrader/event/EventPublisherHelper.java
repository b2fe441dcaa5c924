package com.gridtrader.event;

import com.gridtrader.domain.enums.EventSeverity;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for grid and risk events.
 *
 * <p>Delivery is synchronous: listeners run on the publishing loop thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Grid ----

    public void publishGridBuilt(Object source, String reason, int ordersPlaced) {
        applicationEventPublisher.publishEvent(new GridEvent(source, GridEventType.GRID_BUILT, reason, ordersPlaced));
    }

    public void publishRecentered(Object source, String reason) {
        applicationEventPublisher.publishEvent(new GridEvent(source, GridEventType.RECENTERED, reason, 0));
    }

    public void publishRecenterFailed(Object source, String reason) {
        applicationEventPublisher.publishEvent(new GridEvent(source, GridEventType.RECENTER_FAILED, reason, 0));
    }

    public void publishFillsProcessed(Object source, int fills) {
        applicationEventPublisher.publishEvent(
                new GridEvent(source, GridEventType.FILL_PROCESSED, "Fills processed", fills));
    }

    // ---- Risk ----

    public void publishRisk(
            Object source, RiskEventType type, EventSeverity severity, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, type, severity, message, details));
    }
}
