package com.gridtrader.grid;

import com.gridtrader.domain.model.GridLevel;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The single mutable ladder for the traded symbol.
 *
 * <p>Only {@link GridStrategyEngine} mutates it, under its recenter lock. Level lists are
 * replaced wholesale on every rebuild, never merged, so readers on other loop threads always
 * see either the old ladder or the new one.
 */
public class GridState {

    private volatile BigDecimal centerPrice;
    private volatile List<GridLevel> buyLevels = List.of();
    private volatile List<GridLevel> sellLevels = List.of();
    private volatile LocalDateTime lastRecenterTime;
    private final Map<String, GridLevel> activeOrders = new ConcurrentHashMap<>();
    private final PriceHistory priceHistory;

    public GridState(int maxHistoryPoints, LocalDateTime createdAt) {
        this.priceHistory = new PriceHistory(maxHistoryPoints);
        this.lastRecenterTime = createdAt;
    }

    void replaceLadder(BigDecimal center, List<GridLevel> buys, List<GridLevel> sells) {
        this.centerPrice = center;
        this.buyLevels = List.copyOf(buys);
        this.sellLevels = List.copyOf(sells);
    }

    void trackOrder(String orderId, GridLevel level) {
        activeOrders.put(orderId, level);
    }

    void clearActiveOrders() {
        activeOrders.clear();
    }

    void setCenterPrice(BigDecimal centerPrice) {
        this.centerPrice = centerPrice;
    }

    void setLastRecenterTime(LocalDateTime lastRecenterTime) {
        this.lastRecenterTime = lastRecenterTime;
    }

    public BigDecimal getCenterPrice() {
        return centerPrice;
    }

    /** Closest to center first. */
    public List<GridLevel> getBuyLevels() {
        return buyLevels;
    }

    /** Closest to center first. */
    public List<GridLevel> getSellLevels() {
        return sellLevels;
    }

    public LocalDateTime getLastRecenterTime() {
        return lastRecenterTime;
    }

    public Map<String, GridLevel> getActiveOrders() {
        return Map.copyOf(activeOrders);
    }

    public GridLevel getActiveOrder(String orderId) {
        return activeOrders.get(orderId);
    }

    public int getActiveOrderCount() {
        return activeOrders.size();
    }

    public PriceHistory getPriceHistory() {
        return priceHistory;
    }
}
