package com.gridtrader.api.dto.response;

import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.domain.model.GridStats;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Ladder stats plus the live open orders, buys highest first and sells lowest first. */
@Data
@Builder
public class GridLevelsResponse {

    private GridStats stats;
    private BigDecimal currentPrice;
    private List<ExchangeOrder> buyOrders;
    private List<ExchangeOrder> sellOrders;
    private int totalOrders;
}
