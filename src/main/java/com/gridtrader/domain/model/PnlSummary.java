package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.PnlPeriod;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PnlSummary {

    private Long id;
    private PnlPeriod period;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal totalFees;

    /** Largest peak-to-trough equity drop within the period, as a fraction of the peak. */
    private BigDecimal maxDrawdown;

    private LocalDateTime calculatedAt;
}
