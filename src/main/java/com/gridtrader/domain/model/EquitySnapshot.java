package com.gridtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class EquitySnapshot {

    private Long id;
    private BigDecimal totalEquity;
    private BigDecimal availableBalance;
    private BigDecimal unrealizedPnl;
    private BigDecimal totalPositionsValue;
    private LocalDateTime snapshotAt;
}
