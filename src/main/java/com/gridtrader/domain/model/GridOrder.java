package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** A placed grid or take-profit order as recorded in the state store. */
@Data
@Builder
public class GridOrder {

    private Long id;
    private String orderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;
    private String orderType;
    private OrderStatus status;

    /** Signed grid level; 0 for take-profit orders. */
    private Integer gridLevel;

    private LocalDateTime createdAt;
    private LocalDateTime filledAt;
}
