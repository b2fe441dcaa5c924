package com.gridtrader.risk;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.model.ExchangePosition;
import com.gridtrader.domain.model.RiskMetrics;
import com.gridtrader.domain.model.SafetyStatus;
import com.gridtrader.domain.model.Ticker;
import com.gridtrader.domain.model.WalletBalance;
import com.gridtrader.event.EventPublisherHelper;
import com.gridtrader.event.RiskEventType;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.persistence.StateStore;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Capital-preservation checks that run independently of the grid strategy.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>equity tracking against the daily high, latching {@link KillSwitchService} on drawdown</li>
 *   <li>the exposure gate the grid monitor consults before a rebuild</li>
 *   <li>maker-safety and order-size checks for individual orders</li>
 *   <li>metrics and safety status for the REST layer</li>
 * </ul>
 *
 * <p>The exposure gate and the kill switch are independent: an exposure breach is logged and
 * blocks rebuilds but never latches the switch.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Typical 8h funding rate, three fundings per day. */
    private static final BigDecimal FUNDING_RATE = new BigDecimal("0.0001");

    private static final int FUNDINGS_PER_DAY = 3;

    private final ExchangeGateway exchangeGateway;
    private final KillSwitchService killSwitchService;
    private final StateStore stateStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final RiskLimits riskLimits;
    private final GridBotProperties properties;
    private final Clock clock;

    private final RiskState riskState = new RiskState();

    public RiskManager(
            ExchangeGateway exchangeGateway,
            KillSwitchService killSwitchService,
            StateStore stateStore,
            EventPublisherHelper eventPublisherHelper,
            RiskLimits riskLimits,
            GridBotProperties properties,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.killSwitchService = killSwitchService;
        this.stateStore = stateStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.riskLimits = riskLimits;
        this.properties = properties;
        this.clock = clock;
        log.info(
                "Risk manager initialized: maxExposure={}, killSwitchDrawdown={}, maxPositionSize={}",
                riskLimits.getMaxExposurePct(),
                riskLimits.getKillSwitchDrawdownPct(),
                riskLimits.getMaxPositionSizePct());
    }

    // ========================
    // EQUITY / DRAWDOWN
    // ========================

    /**
     * Refreshes equity from the wallet, rolls the daily high and latches the kill switch when
     * the drawdown reaches the threshold. A wallet failure leaves the state untouched.
     */
    public void updateEquityTracking() {
        Optional<BigDecimal> equity = fetchTotalEquity();
        if (equity.isEmpty()) {
            return;
        }
        if (riskState.recordEquity(equity.get(), LocalDateTime.now(clock))) {
            log.info("New day - reset daily max equity to {}", equity.get());
        }
        checkDrawdown();
    }

    private void checkDrawdown() {
        BigDecimal dailyMax = riskState.getDailyMaxEquity();
        if (dailyMax.signum() <= 0) {
            return;
        }
        BigDecimal drawdown = riskState.drawdown();
        if (drawdown.compareTo(riskLimits.getKillSwitchDrawdownPct()) < 0 || killSwitchService.isActive()) {
            return;
        }
        BigDecimal equity = riskState.getTotalEquity();
        String reason = String.format(
                "Drawdown %s%% exceeds threshold %s%% (Max: %s, Current: %s)",
                percent(drawdown, 2),
                percent(riskLimits.getKillSwitchDrawdownPct(), 0),
                dailyMax,
                equity);

        Map<String, Object> details = new HashMap<>();
        details.put("equity", equity);
        details.put("dailyMax", dailyMax);
        details.put("drawdownPct", percent(drawdown, 4));
        killSwitchService.activate(reason, details);
    }

    // ========================
    // EXPOSURE GATE
    // ========================

    /**
     * Sum of {@code size x markPrice} over open positions divided by total equity, compared to
     * {@code maxExposurePct}.
     *
     * @return true if within limits; false when exceeded or when positions or equity are unavailable
     */
    public boolean checkMaxExposure() {
        GatewayResult<List<ExchangePosition>> positions = exchangeGateway.getPositions(symbol());
        if (positions.isFailure()) {
            log.error("Error checking max exposure: {}", positions.getError().message());
            return false;
        }
        BigDecimal exposure = BigDecimal.ZERO;
        for (ExchangePosition position : positions.getValue()) {
            exposure = exposure.add(position.markValue());
        }
        riskState.updateExposure(exposure);

        fetchTotalEquity().ifPresent(riskState::updateTotalEquity);
        BigDecimal equity = riskState.getTotalEquity();
        if (equity.signum() <= 0) {
            log.warn("Total equity is 0, cannot check exposure");
            return false;
        }

        BigDecimal exposurePct = exposure.divide(equity, MC);
        if (exposurePct.compareTo(riskLimits.getMaxExposurePct()) > 0) {
            log.warn(
                    "Max exposure exceeded: {}% > {}% ({} / {})",
                    percent(exposurePct, 1),
                    percent(riskLimits.getMaxExposurePct(), 0),
                    exposure,
                    equity);
            Map<String, Object> details = new HashMap<>();
            details.put("exposure", exposure);
            details.put("totalEquity", equity);
            details.put("exposurePct", percent(exposurePct, 2));
            stateStore.logEvent(
                    BotEventType.MAX_EXPOSURE,
                    EventSeverity.WARNING,
                    "Maximum exposure exceeded: " + percent(exposurePct, 1) + "%",
                    details);
            eventPublisherHelper.publishRisk(
                    this,
                    RiskEventType.MAX_EXPOSURE_EXCEEDED,
                    EventSeverity.WARNING,
                    "Maximum exposure exceeded",
                    details);
            return false;
        }
        return true;
    }

    // ========================
    // ORDER CHECKS
    // ========================

    /**
     * Whether a limit order at {@code price} would rest in the book. A buy at or above the best
     * ask, or a sell at or below the best bid, would cross and pay taker fees.
     *
     * @return false if the order would cross, or if the ticker is unavailable
     */
    public boolean checkOrderAsMaker(OrderSide side, BigDecimal price) {
        GatewayResult<Ticker> ticker = exchangeGateway.getTicker(symbol());
        if (ticker.isFailure()) {
            log.warn("Ticker unavailable for maker check: {}", ticker.getError().message());
            return false;
        }
        BigDecimal bestBid = ticker.getValue().getBestBid();
        BigDecimal bestAsk = ticker.getValue().getBestAsk();
        if (side == OrderSide.BUY && bestAsk != null && price.compareTo(bestAsk) >= 0) {
            log.warn("BUY order at {} would cross spread (ask={}) - taker risk", price, bestAsk);
            return false;
        }
        if (side == OrderSide.SELL && bestBid != null && price.compareTo(bestBid) <= 0) {
            log.warn("SELL order at {} would cross spread (bid={}) - taker risk", price, bestBid);
            return false;
        }
        return true;
    }

    /** Rejects an order whose value exceeds {@code maxPositionSizePct} of total equity. */
    public boolean validateOrderSize(BigDecimal quantity, BigDecimal price) {
        if (riskState.getTotalEquity().signum() <= 0) {
            fetchTotalEquity().ifPresent(riskState::updateTotalEquity);
        }
        BigDecimal equity = riskState.getTotalEquity();
        if (equity.signum() <= 0) {
            return false;
        }
        BigDecimal orderPct = quantity.multiply(price).divide(equity, MC);
        if (orderPct.compareTo(riskLimits.getMaxPositionSizePct()) > 0) {
            log.warn(
                    "Order size {}% exceeds max {}%",
                    percent(orderPct, 1),
                    percent(riskLimits.getMaxPositionSizePct(), 0));
            return false;
        }
        return true;
    }

    // ========================
    // KILL SWITCH
    // ========================

    public boolean isKillSwitchActive() {
        return killSwitchService.isActive();
    }

    /**
     * Clears the kill switch and rebases the daily high on the current equity, so the old high
     * does not immediately re-trigger it. No-op when the switch is not active.
     *
     * @return true if the switch was cleared
     */
    public boolean deactivateKillSwitch() {
        if (!killSwitchService.isActive()) {
            return false;
        }
        fetchTotalEquity().ifPresent(riskState::updateTotalEquity);
        if (!killSwitchService.deactivate()) {
            return false;
        }
        riskState.resetDailyMax();
        log.info("Daily max equity reset to {}", riskState.getDailyMaxEquity());
        return true;
    }

    // ========================
    // REPORTING
    // ========================

    /** Refreshes equity and exposure, then reports them. Percentages are 0-100. */
    public RiskMetrics getRiskMetrics() {
        updateEquityTracking();
        checkMaxExposure();

        BigDecimal equity = riskState.getTotalEquity();
        BigDecimal dailyMax = riskState.getDailyMaxEquity();
        BigDecimal exposure = riskState.getCurrentExposure();
        BigDecimal exposurePct = equity.signum() > 0
                ? exposure.divide(equity, MC).multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        BigDecimal drawdownPct = riskState.drawdown().multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP);
        BigDecimal maxExposurePct = riskLimits.getMaxExposurePct().multiply(HUNDRED);
        BigDecimal thresholdPct = riskLimits.getKillSwitchDrawdownPct().multiply(HUNDRED);
        BigDecimal available = equity.multiply(riskLimits.getMaxExposurePct()).subtract(exposure).max(BigDecimal.ZERO);

        return RiskMetrics.builder()
                .killSwitchActive(killSwitchService.isActive())
                .killSwitchReason(killSwitchService.getReason())
                .totalEquity(equity)
                .dailyMaxEquity(dailyMax)
                .currentExposure(exposure)
                .exposurePct(exposurePct)
                .maxExposurePct(maxExposurePct)
                .currentDrawdownPct(drawdownPct)
                .killSwitchThresholdPct(thresholdPct)
                .availableForTrading(available)
                .withinLimits(exposurePct.compareTo(maxExposurePct) <= 0 && drawdownPct.compareTo(thresholdPct) < 0)
                .build();
    }

    /** Last observed state, without calling the exchange. */
    public SafetyStatus getSafetyStatus() {
        BigDecimal exposureCap = riskState.getTotalEquity().multiply(riskLimits.getMaxExposurePct());
        return SafetyStatus.builder()
                .safeToTrade(!killSwitchService.isActive())
                .killSwitchActive(killSwitchService.isActive())
                .killSwitchReason(killSwitchService.getReason())
                .exposureOk(riskState.getCurrentExposure().compareTo(exposureCap) <= 0)
                .lastCheck(riskState.getLastEquityCheck())
                .build();
    }

    /** Estimated daily funding cost of open positions: {@code value x 0.0001 x 3}. */
    public BigDecimal calculateFundingImpact() {
        GatewayResult<List<ExchangePosition>> positions = exchangeGateway.getPositions(symbol());
        if (positions.isFailure()) {
            log.error("Error calculating funding impact: {}", positions.getError().message());
            return BigDecimal.ZERO;
        }
        BigDecimal total = BigDecimal.ZERO;
        for (ExchangePosition position : positions.getValue()) {
            BigDecimal daily = position.markValue().multiply(FUNDING_RATE);
            total = total.add(daily.multiply(BigDecimal.valueOf(FUNDINGS_PER_DAY)));
        }
        return total;
    }

    public RiskState getRiskState() {
        return riskState;
    }

    // ========================
    // INTERNALS
    // ========================

    private Optional<BigDecimal> fetchTotalEquity() {
        GatewayResult<WalletBalance> wallet = exchangeGateway.getWalletBalance();
        if (wallet.isFailure()) {
            log.error("Error fetching wallet balance: {}", wallet.getError().message());
            return Optional.empty();
        }
        return Optional.ofNullable(wallet.getValue().getTotalEquity());
    }

    private String symbol() {
        return properties.getTrading().getSymbol();
    }

    private static BigDecimal percent(BigDecimal fraction, int scale) {
        return fraction.multiply(HUNDRED).setScale(scale, RoundingMode.HALF_UP);
    }
}
