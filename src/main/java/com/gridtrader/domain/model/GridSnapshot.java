package com.gridtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** A row of grid history: where a ladder was built and why. */
@Data
@Builder
public class GridSnapshot {

    private Long id;
    private BigDecimal centerPrice;
    private BigDecimal lowestBuy;
    private BigDecimal highestSell;
    private int buyLevelCount;
    private int sellLevelCount;
    private BigDecimal gridSpacing;
    private String reason;
    private LocalDateTime createdAt;
}
