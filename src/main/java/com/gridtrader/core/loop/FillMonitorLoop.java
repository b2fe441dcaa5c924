package com.gridtrader.core.loop;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.core.engine.BotContext;
import com.gridtrader.core.engine.TakeProfitPlacer;
import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.domain.model.Execution;
import com.gridtrader.domain.model.GridLevel;
import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.domain.model.Trade;
import com.gridtrader.event.EventPublisherHelper;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.persistence.StateStore;
import com.gridtrader.risk.KillSwitchService;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls recent executions and records each new fill once: the trade is stored, its order is
 * marked FILLED and, when enabled, a take-profit is placed. Fills already stored under the same
 * execId are skipped.
 *
 * <p>While the kill switch is latched fills are still recorded, at the idle interval, but no
 * take-profit is placed.
 */
public class FillMonitorLoop extends PollingLoop {

    private static final Logger log = LoggerFactory.getLogger(FillMonitorLoop.class);

    private final ExchangeGateway exchangeGateway;
    private final GridStrategyEngine gridStrategyEngine;
    private final KillSwitchService killSwitchService;
    private final StateStore stateStore;
    private final TakeProfitPlacer takeProfitPlacer;
    private final EventPublisherHelper eventPublisherHelper;
    private final GridBotProperties properties;
    private final Clock clock;

    public FillMonitorLoop(
            BotContext context,
            ExchangeGateway exchangeGateway,
            GridStrategyEngine gridStrategyEngine,
            KillSwitchService killSwitchService,
            StateStore stateStore,
            TakeProfitPlacer takeProfitPlacer,
            EventPublisherHelper eventPublisherHelper,
            GridBotProperties properties,
            Clock clock) {
        super(context);
        this.exchangeGateway = exchangeGateway;
        this.gridStrategyEngine = gridStrategyEngine;
        this.killSwitchService = killSwitchService;
        this.stateStore = stateStore;
        this.takeProfitPlacer = takeProfitPlacer;
        this.eventPublisherHelper = eventPublisherHelper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "fill monitor";
    }

    @Override
    protected Duration runIteration() {
        GridBotProperties.Monitoring monitoring = properties.getMonitoring();
        GatewayResult<List<Execution>> executions = exchangeGateway.getExecutions(
                properties.getTrading().getSymbol(), monitoring.getExecutionFetchLimit());
        if (executions.isFailure()) {
            log.warn("Execution poll failed: {}", executions.getError().message());
            return monitoring.getFillErrorBackoff();
        }

        int processed = processFills(executions.getValue());
        if (processed > 0) {
            eventPublisherHelper.publishFillsProcessed(this, processed);
        }
        return killSwitchService.isActive() ? monitoring.getKillSwitchIdleInterval() : monitoring.getFillPollInterval();
    }

    @Override
    protected Duration errorBackoff() {
        return properties.getMonitoring().getFillErrorBackoff();
    }

    /** @return number of fills recorded for the first time */
    private int processFills(List<Execution> executions) {
        // Exchange returns newest first; record in execution order.
        List<Execution> ordered = new ArrayList<>(executions);
        Collections.reverse(ordered);

        int processed = 0;
        for (Execution execution : ordered) {
            if (stateStore.tradeExists(execution.getExecId())) {
                continue;
            }
            LocalDateTime executedAt =
                    execution.getExecutedAt() != null ? execution.getExecutedAt() : LocalDateTime.now(clock);
            boolean saved = stateStore.saveTrade(Trade.builder()
                    .execId(execution.getExecId())
                    .orderId(execution.getOrderId())
                    .symbol(properties.getTrading().getSymbol())
                    .side(execution.getSide())
                    .price(execution.getPrice())
                    .quantity(execution.getQuantity())
                    .fee(execution.getFee())
                    .feeCurrency(execution.getFeeCurrency())
                    .maker(execution.isMaker())
                    .gridLevel(gridLevelOf(execution.getOrderId()))
                    .executedAt(executedAt)
                    .build());
            if (!saved) {
                continue;
            }
            log.info("Order filled: {} {} @ {}", execution.getSide(), execution.getQuantity(), execution.getPrice());
            stateStore.updateOrderStatus(execution.getOrderId(), OrderStatus.FILLED, executedAt);
            processed++;

            if (!properties.getTrading().isTakeProfitEnabled()) {
                continue;
            }
            if (killSwitchService.isActive()) {
                log.warn("Kill switch active, no TP for fill {}", execution.getExecId());
            } else {
                takeProfitPlacer.place(execution, context.getActiveProfile());
            }
        }
        return processed;
    }

    private Integer gridLevelOf(String orderId) {
        GridLevel level = gridStrategyEngine.getState().getActiveOrder(orderId);
        if (level != null) {
            return level.getLevelIndex();
        }
        return stateStore.findOrder(orderId).map(GridOrder::getGridLevel).orElse(null);
    }
}
