package com.gridtrader.grid;

import com.gridtrader.domain.model.GridLevel;
import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a ladder computation. On any status other than {@link Status#OK} both level
 * lists are empty.
 */
public record GridCalculationResult(
        Status status, List<GridLevel> buyLevels, List<GridLevel> sellLevels, BigDecimal spacing) {

    public enum Status {
        OK,
        INSUFFICIENT_CAPITAL,
        NO_VALID_LEVELS
    }

    public static GridCalculationResult ok(List<GridLevel> buys, List<GridLevel> sells, BigDecimal spacing) {
        return new GridCalculationResult(Status.OK, List.copyOf(buys), List.copyOf(sells), spacing);
    }

    public static GridCalculationResult failed(Status status, BigDecimal spacing) {
        return new GridCalculationResult(status, List.of(), List.of(), spacing);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /** True when both sides carry at least one level; grid setup requires this. */
    public boolean isTwoSided() {
        return !buyLevels.isEmpty() && !sellLevels.isEmpty();
    }

    public int levelCount() {
        return buyLevels.size() + sellLevels.size();
    }
}
