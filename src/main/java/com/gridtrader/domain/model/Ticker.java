package com.gridtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Top of book and mark price for a symbol. */
@Data
@Builder
public class Ticker {

    private String symbol;
    private BigDecimal bestBid;
    private BigDecimal bestAsk;
    private BigDecimal markPrice;
    private BigDecimal lastPrice;
}
