package com.gridtrader.persistence;

import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.domain.enums.PnlPeriod;
import com.gridtrader.domain.model.ActiveConfig;
import com.gridtrader.domain.model.BotEvent;
import com.gridtrader.domain.model.EquitySnapshot;
import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.domain.model.GridSnapshot;
import com.gridtrader.domain.model.PnlSummary;
import com.gridtrader.domain.model.Trade;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable bot state: placed orders, fills, grid history, equity snapshots, the event log,
 * the active configuration and P&L summaries.
 *
 * <p>Every write is committed before the method returns.
 */
public interface StateStore {

    // ---- Orders ----

    /** Inserts an order; an order id that is already stored is left unchanged. */
    void saveOrder(GridOrder order);

    /** Updates status, and filledAt when non-null. Unknown order ids are ignored. */
    void updateOrderStatus(String orderId, OrderStatus status, LocalDateTime filledAt);

    Optional<GridOrder> findOrder(String orderId);

    // ---- Trades ----

    /** Inserts a fill; returns false if a fill with the same execId already exists. */
    boolean saveTrade(Trade trade);

    boolean tradeExists(String execId);

    /** Fills of the last {@code hours} hours, newest first. */
    List<Trade> getRecentTrades(int hours);

    long countTrades(int hours);

    // ---- Grid history ----

    void saveGridHistory(GridSnapshot snapshot);

    Optional<GridSnapshot> getLatestGrid();

    // ---- Equity ----

    void saveEquitySnapshot(EquitySnapshot snapshot);

    /** Snapshots of the last {@code hours} hours, oldest first. */
    List<EquitySnapshot> getEquitySnapshots(int hours);

    // ---- Events ----

    void logEvent(BotEventType type, EventSeverity severity, String message, Map<String, Object> details);

    List<BotEvent> getRecentEvents(int hours, int limit);

    // ---- Config ----

    Optional<ActiveConfig> getActiveConfig();

    /** Stores {@code config} as the single active configuration. */
    void saveConfig(ActiveConfig config);

    // ---- P&L ----

    /** Aggregates fills and equity snapshots over the period without persisting the result. */
    PnlSummary summarizePnl(PnlPeriod period);

    /**
     * Aggregates fills and equity snapshots over the period. The summary is persisted only
     * when the period contains at least one fill.
     */
    PnlSummary calculateAndSavePnl(PnlPeriod period);
}
