package com.gridtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Snapshot of the risk controller's view of the account. Percentages are expressed
 * in percent (0-100), not fractions.
 */
@Data
@Builder
public class RiskMetrics {

    private boolean killSwitchActive;
    private String killSwitchReason;
    private BigDecimal totalEquity;
    private BigDecimal dailyMaxEquity;
    private BigDecimal currentExposure;
    private BigDecimal exposurePct;
    private BigDecimal maxExposurePct;
    private BigDecimal currentDrawdownPct;
    private BigDecimal killSwitchThresholdPct;
    private BigDecimal availableForTrading;
    private boolean withinLimits;
}
