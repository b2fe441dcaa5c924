package com.gridtrader.risk;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;

/**
 * Equity and exposure as last observed by the risk manager.
 *
 * <p>{@code dailyMaxEquity} resets to the observed equity on the first observation of each UTC
 * day and only rises within a day. Updated by the risk monitor and read by the REST layer, so
 * every accessor is synchronized.
 */
public class RiskState {

    private BigDecimal dailyMaxEquity = BigDecimal.ZERO;
    private BigDecimal totalEquity = BigDecimal.ZERO;
    private BigDecimal currentExposure = BigDecimal.ZERO;
    private LocalDateTime lastEquityCheck;

    /**
     * Records an equity observation.
     *
     * @return true if this observation started a new day and reset the daily high
     */
    public synchronized boolean recordEquity(BigDecimal equity, LocalDateTime now) {
        boolean newDay = lastEquityCheck == null || !now.toLocalDate().equals(lastEquityCheck.toLocalDate());
        if (newDay) {
            dailyMaxEquity = equity;
        } else if (equity.compareTo(dailyMaxEquity) > 0) {
            dailyMaxEquity = equity;
        }
        totalEquity = equity;
        lastEquityCheck = now;
        return newDay;
    }

    public synchronized void updateTotalEquity(BigDecimal equity) {
        this.totalEquity = equity;
    }

    public synchronized void updateExposure(BigDecimal exposure) {
        this.currentExposure = exposure;
    }

    /** Rebases the daily high onto the current equity, e.g. after a kill switch reset. */
    public synchronized void resetDailyMax() {
        this.dailyMaxEquity = totalEquity;
    }

    /** (dailyMax - equity) / dailyMax as a fraction; zero while no daily high is known. */
    public synchronized BigDecimal drawdown() {
        if (dailyMaxEquity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return dailyMaxEquity.subtract(totalEquity).divide(dailyMaxEquity, MathContext.DECIMAL64);
    }

    public synchronized BigDecimal getDailyMaxEquity() {
        return dailyMaxEquity;
    }

    public synchronized BigDecimal getTotalEquity() {
        return totalEquity;
    }

    public synchronized BigDecimal getCurrentExposure() {
        return currentExposure;
    }

    public synchronized LocalDateTime getLastEquityCheck() {
        return lastEquityCheck;
    }
}
