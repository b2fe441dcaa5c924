package com.gridtrader.grid;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.RecenterTrigger;
import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.domain.model.PricePoint;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides whether the ladder must be rebuilt.
 *
 * <p>Conditions are evaluated in priority order and the first one that holds wins:
 * <ol>
 *   <li>no open orders on the exchange</li>
 *   <li>price outside the band formed by the highest open sell and lowest open buy,
 *       widened by {@code priceDeviationPct}</li>
 *   <li>{@code timeBasedHours} elapsed since the last successful rebuild</li>
 *   <li>price spent more than {@code oneSideUpper} (or less than {@code oneSideLower}) of the
 *       last {@code oneSideHours} above center</li>
 *   <li>high/low range of the last hour at or above {@code pumpDumpPct}</li>
 * </ol>
 * The last two need at least {@code minHistorySamples} samples of history.
 *
 * <p>The open order set must come from the exchange, not from the engine's own bookkeeping.
 */
@Component
public class RecenterPolicy {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final GridBotProperties.Recenter config;

    public RecenterPolicy(GridBotProperties properties) {
        this.config = properties.getRecenter();
    }

    public RecenterDecision evaluate(
            BigDecimal currentPrice,
            List<ExchangeOrder> openOrders,
            BigDecimal centerPrice,
            LocalDateTime lastRecenterTime,
            PriceHistory history,
            LocalDateTime now) {
        if (openOrders == null || openOrders.isEmpty()) {
            return RecenterDecision.of(RecenterTrigger.NO_ACTIVE_ORDERS, "No active orders found");
        }

        RecenterDecision band = checkBand(currentPrice, openOrders);
        if (band.triggered()) {
            return band;
        }

        if (lastRecenterTime != null) {
            Duration elapsed = Duration.between(lastRecenterTime, now);
            if (elapsed.toHours() >= config.getTimeBasedHours()) {
                BigDecimal hours =
                        BigDecimal.valueOf(elapsed.toMinutes()).divide(BigDecimal.valueOf(60), 1, RoundingMode.DOWN);
                return RecenterDecision.of(
                        RecenterTrigger.TIME_BASED,
                        "Time-based recenter: " + hours + "h >= " + config.getTimeBasedHours() + "h");
            }
        }

        if (history.size() < config.getMinHistorySamples()) {
            return RecenterDecision.none();
        }

        if (centerPrice != null) {
            RecenterDecision oneSided =
                    checkOneSided(centerPrice, history.since(now.minusHours(config.getOneSideHours())));
            if (oneSided.triggered()) {
                return oneSided;
            }
        }

        return checkPumpDump(history.since(now.minusHours(1)));
    }

    private RecenterDecision checkBand(BigDecimal currentPrice, List<ExchangeOrder> openOrders) {
        BigDecimal lowestBuy = null;
        BigDecimal highestSell = null;
        for (ExchangeOrder order : openOrders) {
            BigDecimal price = order.getPrice();
            if (price == null || price.signum() <= 0) {
                continue;
            }
            if (order.getSide() == OrderSide.BUY) {
                lowestBuy = lowestBuy == null ? price : lowestBuy.min(price);
            } else if (order.getSide() == OrderSide.SELL) {
                highestSell = highestSell == null ? price : highestSell.max(price);
            }
        }

        BigDecimal deviation = config.getPriceDeviationPct();
        String deviationText = deviation.multiply(HUNDRED).stripTrailingZeros().toPlainString() + "%";
        if (highestSell != null) {
            BigDecimal upper = highestSell.multiply(BigDecimal.ONE.add(deviation));
            if (currentPrice.compareTo(upper) > 0) {
                return RecenterDecision.of(
                        RecenterTrigger.BAND_DEVIATION,
                        "Price " + currentPrice + " > highest sell " + highestSell + " + " + deviationText);
            }
        }
        if (lowestBuy != null) {
            BigDecimal lower = lowestBuy.multiply(BigDecimal.ONE.subtract(deviation));
            if (currentPrice.compareTo(lower) < 0) {
                return RecenterDecision.of(
                        RecenterTrigger.BAND_DEVIATION,
                        "Price " + currentPrice + " < lowest buy " + lowestBuy + " - " + deviationText);
            }
        }
        return RecenterDecision.none();
    }

    private RecenterDecision checkOneSided(BigDecimal centerPrice, List<PricePoint> window) {
        if (window.isEmpty()) {
            return RecenterDecision.none();
        }
        long above = window.stream().filter(p -> p.price().compareTo(centerPrice) > 0).count();
        BigDecimal abovePct = BigDecimal.valueOf(above).divide(BigDecimal.valueOf(window.size()), MC);

        if (abovePct.compareTo(config.getOneSideUpper()) > 0) {
            return RecenterDecision.of(
                    RecenterTrigger.ONE_SIDED,
                    "Price above center " + percent(abovePct) + "% of last " + config.getOneSideHours() + "h");
        }
        if (abovePct.compareTo(config.getOneSideLower()) < 0) {
            return RecenterDecision.of(
                    RecenterTrigger.ONE_SIDED,
                    "Price below center " + percent(BigDecimal.ONE.subtract(abovePct)) + "% of last "
                            + config.getOneSideHours() + "h");
        }
        return RecenterDecision.none();
    }

    private RecenterDecision checkPumpDump(List<PricePoint> lastHour) {
        if (lastHour.isEmpty()) {
            return RecenterDecision.none();
        }
        BigDecimal min = null;
        BigDecimal max = null;
        for (PricePoint point : lastHour) {
            min = min == null ? point.price() : min.min(point.price());
            max = max == null ? point.price() : max.max(point.price());
        }
        if (min.signum() <= 0) {
            return RecenterDecision.none();
        }
        BigDecimal move = max.subtract(min).divide(min, MC);
        if (move.compareTo(config.getPumpDumpPct()) >= 0) {
            return RecenterDecision.of(
                    RecenterTrigger.PUMP_DUMP,
                    "Pump/dump detected: " + move.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP) + "% in 1h");
        }
        return RecenterDecision.none();
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
