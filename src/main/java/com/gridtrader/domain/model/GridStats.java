package com.gridtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Read-only view of the current ladder for status reporting. */
@Data
@Builder
public class GridStats {

    private BigDecimal centerPrice;
    private int buyLevelCount;
    private int sellLevelCount;
    private BigDecimal lowestBuy;
    private BigDecimal highestSell;
    private int activeOrderCount;
    private LocalDateTime lastRecenterTime;
}
