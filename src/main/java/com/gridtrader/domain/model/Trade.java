package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A persisted fill. {@code execId} is unique and is what the fill monitor deduplicates on.
 */
@Data
@Builder
public class Trade {

    private Long id;
    private String execId;
    private String orderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal fee;
    private String feeCurrency;
    private boolean maker;

    /** Realized profit of a closing fill. Null while unknown. */
    private BigDecimal profit;

    private Integer gridLevel;
    private LocalDateTime executedAt;
}
