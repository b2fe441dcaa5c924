package com.gridtrader.grid;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.model.GridLevel;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.PricePoint;
import com.gridtrader.exchange.PriceFormatter;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the buy/sell ladder around a center price.
 *
 * <p>Stateless apart from configuration: the price history used for the volatility estimate
 * is passed in, so the same inputs always produce the same ladder.
 *
 * <p>Sizing rules:
 * <ul>
 *   <li>every level must carry at least {@code minNotional x notionalBuffer} of capital, which
 *       caps the achievable level count; below two levels the computation fails</li>
 *   <li>capital is split evenly across all levels</li>
 *   <li>prices floor to the tick and quantities floor to the step; a level whose floored
 *       notional falls under {@code minNotional} is skipped, not corrected</li>
 * </ul>
 */
@Component
public class GridCalculator {

    private static final Logger log = LoggerFactory.getLogger(GridCalculator.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final GridBotProperties.Grid gridProperties;

    public GridCalculator(GridBotProperties properties) {
        this.gridProperties = properties.getGrid();
    }

    // ========================
    // LADDER
    // ========================

    public GridCalculationResult calculate(
            BigDecimal centerPrice,
            GridBotProperties.GridProfile profile,
            BigDecimal availableCapital,
            InstrumentSpec spec,
            List<PricePoint> history) {
        if (centerPrice == null || centerPrice.signum() <= 0) {
            throw new IllegalArgumentException("centerPrice must be positive: " + centerPrice);
        }
        BigDecimal capital = availableCapital == null ? BigDecimal.ZERO : availableCapital.max(BigDecimal.ZERO);
        BigDecimal spacing = resolveSpacing(profile, centerPrice, history);

        BigDecimal minBudgetPerLevel = spec.getMinNotional().multiply(gridProperties.getNotionalBuffer());
        int maxPossibleLevels = capital.divide(minBudgetPerLevel, 0, RoundingMode.FLOOR).intValue();
        if (maxPossibleLevels < 2) {
            log.error(
                    "Insufficient capital: {} supports {} levels, need at least 2 (min {} per level)",
                    capital,
                    maxPossibleLevels,
                    minBudgetPerLevel);
            return GridCalculationResult.failed(GridCalculationResult.Status.INSUFFICIENT_CAPITAL, spacing);
        }

        int perSide = profile.getTargetLevels();
        if (maxPossibleLevels < perSide * 2) {
            perSide = maxPossibleLevels / 2;
            log.warn(
                    "Capital supports {} levels, reducing to {} per side (target {})",
                    maxPossibleLevels,
                    perSide,
                    profile.getTargetLevels());
        }

        BigDecimal budgetPerLevel = capital.divide(BigDecimal.valueOf(perSide * 2L), MC);
        log.info(
                "Calculating grid: center={}, spacing={}, levels={}x2, budget/level={}",
                centerPrice,
                spacing,
                perSide,
                budgetPerLevel.setScale(4, RoundingMode.HALF_UP));

        List<GridLevel> buys = buildSide(OrderSide.BUY, centerPrice, spacing, perSide, budgetPerLevel, spec);
        List<GridLevel> sells = buildSide(OrderSide.SELL, centerPrice, spacing, perSide, budgetPerLevel, spec);

        if (buys.isEmpty() && sells.isEmpty()) {
            log.error("No valid grid levels at center {} with spacing {}", centerPrice, spacing);
            return GridCalculationResult.failed(GridCalculationResult.Status.NO_VALID_LEVELS, spacing);
        }
        return GridCalculationResult.ok(buys, sells, spacing);
    }

    private List<GridLevel> buildSide(
            OrderSide side,
            BigDecimal centerPrice,
            BigDecimal spacing,
            int count,
            BigDecimal budgetPerLevel,
            InstrumentSpec spec) {
        List<GridLevel> levels = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            BigDecimal offset = spacing.multiply(BigDecimal.valueOf(i));
            BigDecimal factor = side == OrderSide.BUY ? BigDecimal.ONE.subtract(offset) : BigDecimal.ONE.add(offset);
            BigDecimal rawPrice = centerPrice.multiply(factor, MC);
            if (rawPrice.signum() <= 0) {
                log.warn("{} level {} skipped: price {} not positive", side, i, rawPrice);
                continue;
            }
            BigDecimal price = PriceFormatter.formatPrice(rawPrice, spec.getTickSize());
            if (!onCorrectSide(side, price, centerPrice)) {
                log.warn("{} level {} skipped: price {} collapses onto center {}", side, i, price, centerPrice);
                continue;
            }

            BigDecimal quantity = quantityFor(price, budgetPerLevel, spec);
            BigDecimal notional = quantity.multiply(price);
            if (notional.compareTo(spec.getMinNotional()) < 0) {
                log.warn(
                        "{} level {} skipped: notional {} < min {}",
                        side,
                        i,
                        notional.setScale(4, RoundingMode.HALF_UP),
                        spec.getMinNotional());
                continue;
            }

            levels.add(GridLevel.builder()
                    .levelIndex(side == OrderSide.BUY ? -i : i)
                    .price(price)
                    .quantity(quantity)
                    .side(side)
                    .notional(notional)
                    .build());
        }
        return levels;
    }

    private BigDecimal quantityFor(BigDecimal price, BigDecimal budget, InstrumentSpec spec) {
        BigDecimal quantity = budget.divide(price, MC);
        quantity = quantity.max(spec.getMinOrderQty());
        quantity = quantity.max(spec.getMinNotional().divide(price, MC));
        return PriceFormatter.formatQuantity(quantity, spec.getQtyStep());
    }

    private static boolean onCorrectSide(OrderSide side, BigDecimal price, BigDecimal centerPrice) {
        int cmp = price.compareTo(centerPrice);
        return side == OrderSide.BUY ? cmp < 0 && price.signum() > 0 : cmp > 0;
    }

    // ========================
    // SPACING
    // ========================

    /**
     * Base spacing of the profile, widened by the volatility multiplier (capped at
     * {@code gridSpacingMax}) when recent volatility exceeds the threshold.
     */
    public BigDecimal resolveSpacing(
            GridBotProperties.GridProfile profile, BigDecimal centerPrice, List<PricePoint> history) {
        BigDecimal base = profile.getGridSpacing();
        BigDecimal volatility = volatility(history);
        if (volatility.signum() <= 0 || centerPrice == null || centerPrice.signum() <= 0) {
            return base;
        }
        BigDecimal volatilityPct = volatility.divide(centerPrice, MC);
        if (volatilityPct.compareTo(gridProperties.getVolatilityThreshold()) > 0) {
            BigDecimal widened = base.multiply(gridProperties.getVolatilityMultiplier())
                    .min(gridProperties.getGridSpacingMax());
            log.info(
                    "High volatility {} > {}, spacing {} -> {}",
                    volatilityPct,
                    gridProperties.getVolatilityThreshold(),
                    base,
                    widened);
            return widened;
        }
        return base;
    }

    /**
     * Mean absolute change between consecutive samples over the last {@code 2 x period}
     * samples. Zero until that many samples exist.
     */
    BigDecimal volatility(List<PricePoint> history) {
        int window = gridProperties.getVolatilityPeriod() * 2;
        if (history == null || history.size() < window) {
            return BigDecimal.ZERO;
        }
        List<PricePoint> recent = history.subList(history.size() - window, history.size());
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 1; i < recent.size(); i++) {
            total = total.add(recent.get(i).price().subtract(recent.get(i - 1).price()).abs());
        }
        int deltas = recent.size() - 1;
        return deltas > 0 ? total.divide(BigDecimal.valueOf(deltas), MC) : BigDecimal.ZERO;
    }
}
