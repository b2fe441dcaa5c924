package com.gridtrader.grid;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.domain.enums.OrderType;
import com.gridtrader.domain.enums.TimeInForce;
import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.domain.model.GridLevel;
import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.domain.model.GridSnapshot;
import com.gridtrader.domain.model.GridStats;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.OrderRequest;
import com.gridtrader.domain.model.WalletBalance;
import com.gridtrader.event.EventPublisherHelper;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.exchange.InstrumentSpecResolver;
import com.gridtrader.persistence.StateStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the ladder for the configured symbol: builds it, decides when it must be rebuilt, and
 * rebuilds it.
 *
 * <p>The monitoring loops run on separate threads, so the cancel -> rebuild sequence runs under
 * {@link #rebuildLock}. A rebuild first fetches a fresh price and computes the new ladder; only
 * if that succeeds are resting orders cancelled and the new levels placed. A failure after the
 * cancel leaves the book empty and is reported as {@link BotEventType#RECENTER_FAILED}; the next
 * grid monitor cycle picks it up through the "no active orders" trigger.
 *
 * <p>A registered halt check (the kill switch latch) is re-read under the lock before the
 * cancel and before every placement. A rebuild that finds trading halted stops placing and is
 * reported as {@link BotEventType#RECENTER_FAILED}.
 *
 * <p>{@code lastRecenterTime} starts at engine creation and moves only when a rebuild places
 * at least one order.
 */
@Service
public class GridStrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(GridStrategyEngine.class);

    private final ExchangeGateway exchangeGateway;
    private final InstrumentSpecResolver instrumentSpecResolver;
    private final GridCalculator gridCalculator;
    private final RecenterPolicy recenterPolicy;
    private final StateStore stateStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final GridBotProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    private final GridState state;
    private final ReentrantLock rebuildLock = new ReentrantLock();
    private volatile BooleanSupplier tradingHalted = () -> false;

    public GridStrategyEngine(
            ExchangeGateway exchangeGateway,
            InstrumentSpecResolver instrumentSpecResolver,
            GridCalculator gridCalculator,
            RecenterPolicy recenterPolicy,
            StateStore stateStore,
            EventPublisherHelper eventPublisherHelper,
            GridBotProperties properties,
            Clock clock,
            Sleeper sleeper) {
        this.exchangeGateway = exchangeGateway;
        this.instrumentSpecResolver = instrumentSpecResolver;
        this.gridCalculator = gridCalculator;
        this.recenterPolicy = recenterPolicy;
        this.stateStore = stateStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.state = new GridState(properties.getGrid().getMaxHistoryPoints(), LocalDateTime.now(clock));
    }

    /**
     * Registers the check that blocks rebuilds while it returns true. The kill switch registers
     * its latch here, since it depends on this engine for cancellation.
     */
    public void registerHaltCheck(BooleanSupplier haltCheck) {
        this.tradingHalted = haltCheck;
    }

    public boolean isTradingHalted() {
        return tradingHalted.getAsBoolean();
    }

    // ========================
    // INITIALIZATION
    // ========================

    /**
     * Loads the instrument spec and restores the last center price from grid history.
     *
     * @throws com.gridtrader.exception.ExchangeException if the instrument spec cannot be loaded
     */
    public void initialize() {
        String symbol = symbol();
        log.info("Initializing grid engine for {}", symbol);
        instrumentSpecResolver.refresh(symbol);

        stateStore.getLatestGrid().ifPresent(latest -> {
            state.setCenterPrice(latest.getCenterPrice());
            log.info("Restored grid center from history: {}", latest.getCenterPrice());
        });
    }

    public InstrumentSpec getInstrumentSpec() {
        return instrumentSpecResolver.resolve(symbol());
    }

    // ========================
    // PRICE
    // ========================

    /** Fetches the mark price and appends it to the price history. Empty on failure. */
    public Optional<BigDecimal> fetchCurrentPrice() {
        GatewayResult<BigDecimal> result = exchangeGateway.getMarkPrice(symbol());
        if (result.isFailure()) {
            log.error("Error getting current price: {}", result.getError().message());
            return Optional.empty();
        }
        BigDecimal price = result.getValue();
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        state.getPriceHistory().add(price, LocalDateTime.now(clock));
        return Optional.of(price);
    }

    // ========================
    // LADDER COMPUTATION
    // ========================

    /**
     * Computes the ladder for {@code centerPrice} without touching the exchange.
     *
     * @throws com.gridtrader.exception.InvalidProfileException if the profile does not exist
     */
    public GridCalculationResult calculateGridLevels(
            BigDecimal centerPrice, String profileName, BigDecimal availableCapital) {
        GridBotProperties.GridProfile profile = properties.getProfile(profileName);
        return gridCalculator.calculate(
                centerPrice,
                profile,
                availableCapital,
                getInstrumentSpec(),
                state.getPriceHistory().snapshot());
    }

    // ========================
    // SETUP / RECENTER
    // ========================

    /**
     * Builds the ladder at the current price and places every level as a post-only limit order.
     *
     * @return true if at least one order was placed
     * @throws com.gridtrader.exception.InvalidProfileException if the profile does not exist
     */
    public boolean setupGrid(String profileName) {
        properties.getProfile(profileName);
        rebuildLock.lock();
        try {
            return rebuild(profileName, "Initial setup with " + profileName + " profile");
        } finally {
            rebuildLock.unlock();
        }
    }

    /** Fresh read of the exchange's open orders and price against the recenter conditions. */
    public RecenterDecision shouldRecenter() {
        Optional<BigDecimal> price = fetchCurrentPrice();
        if (price.isEmpty()) {
            return RecenterDecision.none();
        }
        GatewayResult<List<ExchangeOrder>> openOrders = exchangeGateway.getOpenOrders(symbol());
        if (openOrders.isFailure()) {
            log.error("Error checking active orders for recenter: {}", openOrders.getError().message());
            return RecenterDecision.none();
        }
        return recenterPolicy.evaluate(
                price.get(),
                openOrders.getValue(),
                state.getCenterPrice(),
                state.getLastRecenterTime(),
                state.getPriceHistory(),
                LocalDateTime.now(clock));
    }

    /**
     * Cancels the resting ladder and rebuilds it around the current price.
     *
     * @return true if the new ladder has at least one order
     * @throws com.gridtrader.exception.InvalidProfileException if the profile does not exist;
     *     nothing is cancelled in that case
     */
    public boolean recenterGrid(String reason, String profileName) {
        properties.getProfile(profileName);
        rebuildLock.lock();
        try {
            log.info("Recentering grid. Reason: {}", reason);
            Map<String, Object> details = new HashMap<>();
            details.put("oldCenter", state.getCenterPrice());
            details.put("profile", profileName);
            stateStore.logEvent(
                    BotEventType.RECENTER, EventSeverity.INFO, "Grid recenter triggered: " + reason, details);

            boolean success = rebuild(profileName, reason);
            if (success) {
                log.info("Grid recentered successfully at {}", state.getCenterPrice());
                eventPublisherHelper.publishRecentered(this, reason);
            }
            return success;
        } finally {
            rebuildLock.unlock();
        }
    }

    /** Cancels every resting order and forgets the tracked ones. Used on stop and kill switch. */
    public GatewayResult<Void> cancelAll() {
        rebuildLock.lock();
        try {
            GatewayResult<Void> result = exchangeGateway.cancelAllOrders(symbol());
            if (result.isSuccess()) {
                state.clearActiveOrders();
            } else {
                log.error("Cancel all orders failed: {}", result.getError().message());
            }
            return result;
        } finally {
            rebuildLock.unlock();
        }
    }

    private boolean rebuild(String profileName, String reason) {
        if (isTradingHalted()) {
            return fail(reason, "Trading halted by kill switch", false);
        }
        Optional<BigDecimal> price = fetchCurrentPrice();
        if (price.isEmpty()) {
            return fail(reason, "Failed to get current price", false);
        }
        BigDecimal center = price.get();
        GridCalculationResult ladder = calculateGridLevels(center, profileName, resolveCapital());
        if (!ladder.isOk() || !ladder.isTwoSided()) {
            return fail(reason, "Failed to calculate valid grid levels: " + ladder.status(), false);
        }

        if (isTradingHalted()) {
            return fail(reason, "Trading halted by kill switch", false);
        }
        GatewayResult<Void> cancelled = exchangeGateway.cancelAllOrders(symbol());
        if (cancelled.isFailure()) {
            return fail(reason, "Cancel before rebuild failed: " + cancelled.getError().message(), false);
        }
        state.clearActiveOrders();
        if (!pause(properties.getGrid().getSettleDelay())) {
            return fail(reason, "Interrupted while waiting for cancellations", true);
        }

        state.replaceLadder(center, ladder.buyLevels(), ladder.sellLevels());
        int buysPlaced = placeLevels(ladder.buyLevels());
        int sellsPlaced = placeLevels(ladder.sellLevels());
        log.info("Grid setup complete: {} BUY + {} SELL orders placed", buysPlaced, sellsPlaced);
        if (isTradingHalted()) {
            return fail(reason, "Trading halted by kill switch during placement", true);
        }
        if (buysPlaced + sellsPlaced == 0) {
            return fail(reason, "No grid orders were accepted by the exchange", true);
        }

        List<GridLevel> buys = ladder.buyLevels();
        List<GridLevel> sells = ladder.sellLevels();
        stateStore.saveGridHistory(GridSnapshot.builder()
                .centerPrice(center)
                .lowestBuy(buys.get(buys.size() - 1).getPrice())
                .highestSell(sells.get(sells.size() - 1).getPrice())
                .buyLevelCount(buys.size())
                .sellLevelCount(sells.size())
                .gridSpacing(ladder.spacing())
                .reason(reason)
                .build());

        Map<String, Object> details = new HashMap<>();
        details.put("centerPrice", center);
        details.put("profile", profileName);
        details.put("ordersPlaced", buysPlaced + sellsPlaced);
        stateStore.logEvent(
                BotEventType.GRID_SETUP,
                EventSeverity.INFO,
                "Grid initialized with " + buys.size() + " BUY + " + sells.size() + " SELL levels",
                details);

        state.setLastRecenterTime(LocalDateTime.now(clock));
        eventPublisherHelper.publishGridBuilt(this, reason, buysPlaced + sellsPlaced);
        return true;
    }

    private int placeLevels(List<GridLevel> levels) {
        int placed = 0;
        for (GridLevel level : levels) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Placement interrupted, {} {} levels not placed", levels.size() - placed, level.getSide());
                break;
            }
            if (isTradingHalted()) {
                log.warn("Trading halted, {} {} levels not placed", levels.size() - placed, level.getSide());
                break;
            }
            OrderRequest request = OrderRequest.builder()
                    .symbol(symbol())
                    .side(level.getSide())
                    .orderType(OrderType.LIMIT)
                    .quantity(level.getQuantity())
                    .price(level.getPrice())
                    .timeInForce(TimeInForce.POST_ONLY)
                    .build();
            GatewayResult<String> result = exchangeGateway.placeOrder(request);
            if (result.isSuccess()) {
                String orderId = result.getValue();
                state.trackOrder(orderId, level);
                recordOrder(orderId, level);
                placed++;
                log.info(
                        "{} order placed: level={}, price={}, qty={}",
                        level.getSide(),
                        level.getLevelIndex(),
                        level.getPrice(),
                        level.getQuantity());
            } else {
                log.error(
                        "Error placing {} order at level {}: {}",
                        level.getSide(),
                        level.getLevelIndex(),
                        result.getError().message());
            }
            if (!pause(properties.getGrid().getOrderSpacingDelay())) {
                break;
            }
        }
        return placed;
    }

    private void recordOrder(String orderId, GridLevel level) {
        try {
            stateStore.saveOrder(GridOrder.builder()
                    .orderId(orderId)
                    .symbol(symbol())
                    .side(level.getSide())
                    .price(level.getPrice())
                    .quantity(level.getQuantity())
                    .orderType(OrderType.LIMIT.getExchangeValue())
                    .status(OrderStatus.NEW)
                    .gridLevel(level.getLevelIndex())
                    .build());
        } catch (RuntimeException e) {
            // The order is live on the exchange; keep placing the rest of the ladder.
            log.error("Failed to persist order {} at level {}", orderId, level.getLevelIndex(), e);
        }
    }

    private boolean fail(String reason, String cause, boolean ordersCancelled) {
        log.error("Failed to rebuild grid ({}): {}", reason, cause);
        Map<String, Object> details = new HashMap<>();
        details.put("reason", reason);
        details.put("ordersCancelled", ordersCancelled);
        stateStore.logEvent(BotEventType.RECENTER_FAILED, EventSeverity.ERROR, cause, details);
        eventPublisherHelper.publishRecenterFailed(this, cause);
        return false;
    }

    /** Uses the configured capital; warns when the wallet holds less. */
    private BigDecimal resolveCapital() {
        BigDecimal capital = properties.getTrading().getInitialCapital();
        GatewayResult<WalletBalance> wallet = exchangeGateway.getWalletBalance();
        if (wallet.isSuccess()) {
            BigDecimal available = wallet.getValue().getAvailableToWithdraw();
            if (available != null && available.compareTo(capital) < 0) {
                log.warn("Insufficient balance: {} < {}, using configured initial capital", available, capital);
            }
        } else {
            log.warn(
                    "Wallet balance unavailable ({}), using configured capital {}",
                    wallet.getError().message(),
                    capital);
        }
        return capital;
    }

    private boolean pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ========================
    // STATUS
    // ========================

    public GridStats getGridStats() {
        List<GridLevel> buys = state.getBuyLevels();
        List<GridLevel> sells = state.getSellLevels();
        return GridStats.builder()
                .centerPrice(state.getCenterPrice())
                .buyLevelCount(buys.size())
                .sellLevelCount(sells.size())
                .lowestBuy(buys.isEmpty() ? BigDecimal.ZERO : buys.get(buys.size() - 1).getPrice())
                .highestSell(sells.isEmpty() ? BigDecimal.ZERO : sells.get(sells.size() - 1).getPrice())
                .activeOrderCount(state.getActiveOrderCount())
                .lastRecenterTime(state.getLastRecenterTime())
                .build();
    }

    public GridState getState() {
        return state;
    }

    private String symbol() {
        return properties.getTrading().getSymbol();
    }
}
