package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** An open order as reported live by the exchange. */
@Data
@Builder
public class ExchangeOrder {

    private String orderId;
    private String orderLinkId;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal filledQuantity;
    private OrderStatus status;
}
