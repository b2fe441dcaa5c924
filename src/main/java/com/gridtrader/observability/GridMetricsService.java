package com.gridtrader.observability;

import com.gridtrader.event.GridEvent;
import com.gridtrader.event.RiskEvent;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.risk.KillSwitchService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the grid bot:
 * <ul>
 *   <li><b>grid.recenters</b> (counter): successful ladder rebuilds</li>
 *   <li><b>grid.recenter.failures</b> (counter): rebuilds that placed nothing or were aborted</li>
 *   <li><b>grid.fills.processed</b> (counter): fills recorded by the fill monitor</li>
 *   <li><b>risk.kill.switch.activations</b> (counter)</li>
 *   <li><b>risk.kill.switch.state</b> (gauge 0/1)</li>
 *   <li><b>grid.active.orders</b> (gauge): orders placed by the current ladder</li>
 * </ul>
 *
 * <p>Gauges are read lazily at scrape time; counters are fed by event listeners.
 */
@Service
public class GridMetricsService {

    private final Counter recenterCounter;
    private final Counter recenterFailureCounter;
    private final Counter fillsCounter;
    private final Counter killSwitchCounter;

    public GridMetricsService(
            MeterRegistry meterRegistry, GridStrategyEngine gridStrategyEngine, KillSwitchService killSwitchService) {
        this.recenterCounter = Counter.builder("grid.recenters")
                .description("Successful grid rebuilds")
                .register(meterRegistry);

        this.recenterFailureCounter = Counter.builder("grid.recenter.failures")
                .description("Grid rebuilds that failed")
                .register(meterRegistry);

        this.fillsCounter = Counter.builder("grid.fills.processed")
                .description("Fills recorded by the fill monitor")
                .register(meterRegistry);

        this.killSwitchCounter = Counter.builder("risk.kill.switch.activations")
                .description("Kill switch activations")
                .register(meterRegistry);

        meterRegistry.gauge("risk.kill.switch.state", killSwitchService, service -> service.isActive() ? 1.0 : 0.0);
        meterRegistry.gauge(
                "grid.active.orders", gridStrategyEngine, engine -> engine.getState().getActiveOrderCount());
    }

    @EventListener
    @Order(20)
    public void onGridEvent(GridEvent event) {
        switch (event.getEventType()) {
            case RECENTERED:
                recenterCounter.increment();
                break;
            case RECENTER_FAILED:
                recenterFailureCounter.increment();
                break;
            case FILL_PROCESSED:
                fillsCounter.increment(event.getOrderCount());
                break;
            default:
                break;
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.isKillSwitchTrigger()) {
            killSwitchCounter.increment();
        }
    }
}
