package com.gridtrader.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.core.engine.BotContext;
import com.gridtrader.core.loop.GridMonitorLoop;
import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.OrderRequest;
import com.gridtrader.domain.model.WalletBalance;
import com.gridtrader.event.EventPublisherHelper;
import com.gridtrader.event.RiskEvent;
import com.gridtrader.event.RiskEventType;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayError;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.exchange.InstrumentSpecResolver;
import com.gridtrader.grid.GridCalculator;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.grid.RecenterPolicy;
import com.gridtrader.persistence.StateStore;
import com.gridtrader.risk.KillSwitchResult;
import com.gridtrader.risk.KillSwitchService;
import com.gridtrader.risk.RiskLimits;
import com.gridtrader.risk.RiskManager;
import com.gridtrader.testutil.MutableClock;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-service integration test for the drawdown kill switch.
 * Wires real RiskManager + KillSwitchService + GridStrategyEngine together with the exchange
 * and the state store mocked to verify the sequence:
 * grid built -> equity drops past the threshold -> switch latches -> orders cancelled -> operator clears.
 */
@ExtendWith(MockitoExtension.class)
class KillSwitchIntegrationTest {

    private static final String SYMBOL = "XRPUSDT";

    @Mock
    private ExchangeGateway exchangeGateway;

    @Mock
    private StateStore stateStore;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private final AtomicReference<BigDecimal> equity = new AtomicReference<>(new BigDecimal("1000"));
    private final AtomicInteger orderIds = new AtomicInteger();

    private GridStrategyEngine gridStrategyEngine;
    private KillSwitchService killSwitchService;
    private RiskManager riskManager;
    private GridBotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GridBotProperties();
        MutableClock clock = new MutableClock(LocalDateTime.of(2025, 3, 10, 9, 0));
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);

        InstrumentSpecResolver instrumentSpecResolver = mock(InstrumentSpecResolver.class);
        lenient().when(instrumentSpecResolver.resolve(SYMBOL)).thenReturn(InstrumentSpec.builder()
                .symbol(SYMBOL)
                .minOrderQty(new BigDecimal("0.001"))
                .qtyStep(new BigDecimal("0.001"))
                .tickSize(new BigDecimal("0.01"))
                .minNotional(new BigDecimal("5"))
                .build());

        gridStrategyEngine = new GridStrategyEngine(
                exchangeGateway,
                instrumentSpecResolver,
                new GridCalculator(properties),
                new RecenterPolicy(properties),
                stateStore,
                eventPublisherHelper,
                properties,
                clock,
                duration -> {});
        killSwitchService = new KillSwitchService(gridStrategyEngine, stateStore, eventPublisherHelper, clock);
        riskManager = new RiskManager(
                exchangeGateway,
                killSwitchService,
                stateStore,
                eventPublisherHelper,
                RiskLimits.builder()
                        .maxExposurePct(new BigDecimal("0.80"))
                        .killSwitchDrawdownPct(new BigDecimal("0.05"))
                        .maxPositionSizePct(new BigDecimal("0.20"))
                        .build(),
                properties,
                clock);

        lenient().when(exchangeGateway.getWalletBalance()).thenAnswer(inv -> GatewayResult.ok(WalletBalance.builder()
                .totalEquity(equity.get())
                .availableToWithdraw(equity.get())
                .build()));
        lenient().when(exchangeGateway.getMarkPrice(SYMBOL)).thenReturn(GatewayResult.ok(new BigDecimal("100")));
        lenient().when(exchangeGateway.cancelAllOrders(SYMBOL)).thenReturn(GatewayResult.ok(null));
        lenient().when(exchangeGateway.placeOrder(any(OrderRequest.class)))
                .thenAnswer(inv -> GatewayResult.ok("ord-" + orderIds.incrementAndGet()));
        lenient().when(exchangeGateway.getPositions(SYMBOL)).thenReturn(GatewayResult.ok(List.of()));
    }

    @Test
    @DisplayName("Drawdown past the threshold latches the switch and cancels the live grid")
    void drawdownLatchesAndCancelsGrid() {
        assertThat(gridStrategyEngine.setupGrid("Normal")).isTrue();
        assertThat(gridStrategyEngine.getState().getActiveOrderCount()).isPositive();

        riskManager.updateEquityTracking();
        assertThat(killSwitchService.isActive()).isFalse();

        equity.set(new BigDecimal("940"));
        riskManager.updateEquityTracking();

        assertThat(killSwitchService.isActive()).isTrue();
        assertThat(killSwitchService.getReason()).startsWith("Drawdown 6.00% exceeds threshold 5%");
        assertThat(gridStrategyEngine.getState().getActiveOrderCount()).isZero();
        // once by the initial setup, once by the kill switch
        verify(exchangeGateway, times(2)).cancelAllOrders(SYMBOL);
        verify(stateStore)
                .logEvent(eq(BotEventType.KILL_SWITCH), eq(EventSeverity.CRITICAL), anyString(), anyMap());

        ArgumentCaptor<ApplicationEvent> events = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(events.capture());
        List<RiskEvent> riskEvents = events.getAllValues().stream()
                .filter(RiskEvent.class::isInstance)
                .map(RiskEvent.class::cast)
                .toList();
        assertThat(riskEvents)
                .extracting(RiskEvent::getEventType)
                .containsExactly(RiskEventType.KILL_SWITCH_TRIGGERED);
    }

    @Test
    @DisplayName("Equity recovery keeps the switch latched without cancelling again")
    void recoveryDoesNotClearLatch() {
        riskManager.updateEquityTracking();
        equity.set(new BigDecimal("940"));
        riskManager.updateEquityTracking();

        equity.set(new BigDecimal("1010"));
        riskManager.updateEquityTracking();
        equity.set(new BigDecimal("900"));
        riskManager.updateEquityTracking();

        assertThat(killSwitchService.isActive()).isTrue();
        assertThat(killSwitchService.getReason()).contains("Current: 940");
        verify(exchangeGateway, times(1)).cancelAllOrders(SYMBOL);
    }

    @Test
    @DisplayName("Manual deactivation rebases the daily high so the old peak does not re-trigger")
    void deactivationRebasesDailyHigh() {
        riskManager.updateEquityTracking();
        equity.set(new BigDecimal("940"));
        riskManager.updateEquityTracking();

        assertThat(riskManager.deactivateKillSwitch()).isTrue();
        assertThat(riskManager.getRiskState().getDailyMaxEquity()).isEqualByComparingTo("940");

        riskManager.updateEquityTracking();

        assertThat(killSwitchService.isActive()).isFalse();
        assertThat(riskManager.getSafetyStatus().isSafeToTrade()).isTrue();
        verify(stateStore).logEvent(
                eq(BotEventType.KILL_SWITCH_DEACTIVATED), eq(EventSeverity.INFO), anyString(), anyMap());
    }

    @Test
    @DisplayName("Latch between the recenter check and the rebuild places no new ladder")
    void latchDuringRecenterCheckBlocksRebuild() {
        BotContext context = new BotContext("Normal");
        GridMonitorLoop gridMonitorLoop =
                new GridMonitorLoop(context, gridStrategyEngine, riskManager, killSwitchService, properties);
        when(exchangeGateway.getOpenOrders(SYMBOL)).thenAnswer(inv -> {
            killSwitchService.activate("Drawdown 6.00% exceeds threshold 5%", null);
            return GatewayResult.ok(List.of());
        });

        gridMonitorLoop.runOnce();

        assertThat(killSwitchService.isActive()).isTrue();
        verify(exchangeGateway, never()).placeOrder(any(OrderRequest.class));
        verify(exchangeGateway, times(1)).cancelAllOrders(SYMBOL);
        assertThat(gridStrategyEngine.getState().getActiveOrderCount()).isZero();
        verify(stateStore).logEvent(
                eq(BotEventType.RECENTER_FAILED),
                eq(EventSeverity.ERROR),
                eq("Trading halted by kill switch"),
                anyMap());
    }

    @Test
    @DisplayName("A failed cancel still latches the switch and reports the error")
    void cancelFailureStillLatches() {
        when(exchangeGateway.cancelAllOrders(SYMBOL))
                .thenReturn(GatewayResult.failure(GatewayError.transport("connection reset")));

        KillSwitchResult result = killSwitchService.activate("Manual test", null);

        assertThat(result.isActivated()).isTrue();
        assertThat(result.isOrdersCancelled()).isFalse();
        assertThat(result.getErrors()).singleElement().asString().contains("connection reset");
        assertThat(riskManager.isKillSwitchActive()).isTrue();
    }
}
