package com.gridtrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.event.GridEvent;
import com.gridtrader.event.GridEventType;
import com.gridtrader.event.RiskEvent;
import com.gridtrader.event.RiskEventType;
import com.gridtrader.grid.GridState;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.observability.GridMetricsService;
import com.gridtrader.risk.KillSwitchService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for GridMetricsService counters and gauges.
 *
 * <p>Lenient strictness because gauges read the mocks only when polled.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GridMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private GridMetricsService gridMetricsService;

    @Mock
    private GridStrategyEngine gridStrategyEngine;

    @Mock
    private KillSwitchService killSwitchService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(gridStrategyEngine.getState()).thenReturn(new GridState(10, LocalDateTime.of(2025, 3, 10, 12, 0)));
        gridMetricsService = new GridMetricsService(meterRegistry, gridStrategyEngine, killSwitchService);
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Counter metrics")
    class CounterMetrics {

        @Test
        @DisplayName("grid.recenters and grid.recenter.failures follow recenter outcomes")
        void recenterCounters() {
            gridMetricsService.onGridEvent(new GridEvent(this, GridEventType.RECENTERED, "Time-based", 0));
            gridMetricsService.onGridEvent(new GridEvent(this, GridEventType.RECENTERED, "Pump/dump", 0));
            gridMetricsService.onGridEvent(new GridEvent(this, GridEventType.RECENTER_FAILED, "No price", 0));

            assertThat(counter("grid.recenters")).isEqualTo(2.0);
            assertThat(counter("grid.recenter.failures")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("grid.fills.processed adds the batch size")
        void fillsCounter() {
            gridMetricsService.onGridEvent(new GridEvent(this, GridEventType.FILL_PROCESSED, "Fills processed", 3));
            gridMetricsService.onGridEvent(new GridEvent(this, GridEventType.GRID_BUILT, "Initial setup", 16));

            assertThat(counter("grid.fills.processed")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("risk.kill.switch.activations counts only kill switch triggers")
        void killSwitchCounter() {
            gridMetricsService.onRiskEvent(
                    new RiskEvent(this, RiskEventType.KILL_SWITCH_TRIGGERED, EventSeverity.CRITICAL, "Drawdown"));
            gridMetricsService.onRiskEvent(
                    new RiskEvent(this, RiskEventType.MAX_EXPOSURE_EXCEEDED, EventSeverity.WARNING, "Exposure"));

            assertThat(counter("risk.kill.switch.activations")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauge metrics")
    class GaugeMetrics {

        @Test
        @DisplayName("risk.kill.switch.state reflects the latch")
        void killSwitchGauge() {
            when(killSwitchService.isActive()).thenReturn(true);

            assertThat(meterRegistry.get("risk.kill.switch.state").gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("grid.active.orders reads the tracked order count")
        void activeOrdersGauge() {
            assertThat(meterRegistry.get("grid.active.orders").gauge().value()).isZero();
        }
    }
}
