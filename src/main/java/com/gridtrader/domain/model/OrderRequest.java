package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.OrderType;
import com.gridtrader.domain.enums.TimeInForce;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A new order to submit. {@code orderLinkId} is the client-assigned id the exchange uses to
 * reject duplicates, so a caller that retries a placement must reuse the same request.
 */
@Data
@Builder
public class OrderRequest {

    private String symbol;
    private OrderSide side;
    private OrderType orderType;
    private BigDecimal quantity;
    private BigDecimal price;
    private TimeInForce timeInForce;
    private String orderLinkId;
}
