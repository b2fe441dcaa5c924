package com.gridtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Aggregate status for the dashboard: run state, balance, ladder and risk in one view. */
@Data
@Builder
public class BotStatus {

    private boolean running;
    private String profile;
    private String symbol;
    private BigDecimal availableBalance;
    private BigDecimal equity;
    private int openPositions;
    private GridStats grid;
    private RiskMetrics risk;
    private long trades24h;
    private LocalDateTime startedAt;
    private LocalDateTime timestamp;
}
