package com.gridtrader.event;

import com.gridtrader.domain.enums.EventSeverity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the risk manager and kill switch when a risk condition is detected or cleared.
 *
 * <p>Listeners: {@code GridMetricsService} (kill switch counter) and
 * {@code GridBotSupervisor} (stops the trading loops on a trigger).
 */
@Getter
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final EventSeverity severity;
    private final String message;

    /**
     * Condition-specific details, e.g. for KILL_SWITCH_TRIGGERED:
     * {"equity": 900, "dailyMax": 1000, "drawdownPct": 10.0}. Read-only.
     */
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, EventSeverity severity, String message) {
        this(source, eventType, severity, message, null);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            EventSeverity severity,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.severity = severity;
        this.message = message;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isKillSwitchTrigger() {
        return eventType == RiskEventType.KILL_SWITCH_TRIGGERED;
    }
}
