package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * One rung of the grid ladder.
 *
 * <p>{@code levelIndex} is signed: its magnitude is the distance in spacing steps from the
 * center and its sign is the side (negative for buys below center, positive for sells above).
 * Take-profit orders use level 0.
 */
@Data
@Builder
public class GridLevel {

    private int levelIndex;
    private BigDecimal price;
    private BigDecimal quantity;
    private OrderSide side;
    private BigDecimal notional;
}
