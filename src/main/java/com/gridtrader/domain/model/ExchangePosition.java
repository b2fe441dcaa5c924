package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** An open perpetual position. Size is unsigned; {@code side} carries direction. */
@Data
@Builder
public class ExchangePosition {

    private String symbol;
    private OrderSide side;
    private BigDecimal size;
    private BigDecimal entryPrice;
    private BigDecimal markPrice;
    private BigDecimal positionValue;
    private BigDecimal unrealisedPnl;
    private int leverage;

    public boolean isOpen() {
        return size != null && size.signum() > 0;
    }

    /** size x markPrice, the value the exposure check works with. */
    public BigDecimal markValue() {
        if (!isOpen() || markPrice == null) {
            return BigDecimal.ZERO;
        }
        return size.multiply(markPrice);
    }
}
