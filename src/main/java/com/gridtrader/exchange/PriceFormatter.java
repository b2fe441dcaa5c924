package com.gridtrader.exchange;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Floors prices and quantities onto an instrument's tick/step grid.
 *
 * <p>Values are always rounded down so an order never commits more capital than budgeted
 * and never lands off-grid. The result carries the scale of the step, so formatting an
 * already formatted value returns an equal value.
 */
public final class PriceFormatter {

    private PriceFormatter() {}

    public static BigDecimal formatPrice(BigDecimal price, BigDecimal tickSize) {
        return floorToStep(price, tickSize);
    }

    public static BigDecimal formatQuantity(BigDecimal quantity, BigDecimal qtyStep) {
        return floorToStep(quantity, qtyStep);
    }

    static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (step == null || step.signum() <= 0) {
            throw new IllegalArgumentException("step must be positive, got " + step);
        }
        int scale = Math.max(step.stripTrailingZeros().scale(), 0);
        BigDecimal steps = value.divide(step, 0, RoundingMode.FLOOR);
        return steps.multiply(step).setScale(scale, RoundingMode.FLOOR);
    }
}
