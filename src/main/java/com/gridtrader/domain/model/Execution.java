package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** A single fill reported by the exchange execution feed. */
@Data
@Builder
public class Execution {

    private String execId;
    private String orderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal fee;
    private String feeCurrency;
    private boolean maker;
    private LocalDateTime executedAt;
}
