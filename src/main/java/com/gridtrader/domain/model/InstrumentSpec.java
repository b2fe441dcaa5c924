package com.gridtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Exchange trading constraints for one symbol: minimum order quantity, quantity step,
 * price tick and minimum order notional. Loaded once when the grid engine initializes.
 */
@Data
@Builder
public class InstrumentSpec {

    private String symbol;
    private BigDecimal minOrderQty;
    private BigDecimal qtyStep;
    private BigDecimal tickSize;
    private BigDecimal minNotional;
}
