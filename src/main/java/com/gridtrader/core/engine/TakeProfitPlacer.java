package com.gridtrader.core.engine;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.domain.enums.OrderType;
import com.gridtrader.domain.enums.TimeInForce;
import com.gridtrader.domain.model.Execution;
import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.OrderRequest;
import com.gridtrader.domain.model.Ticker;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.exchange.PriceFormatter;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.persistence.StateStore;
import com.gridtrader.risk.RiskManager;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Places the closing order for a grid fill: a BUY fill gets a SELL above it, a SELL fill a BUY
 * below it, {@code profitTarget} away. Always post-only; if the target would cross the book it
 * is moved just outside the touch. Orders larger than the position size limit are skipped.
 * Take-profit orders are stored with grid level 0.
 */
@Component
public class TakeProfitPlacer {

    private static final Logger log = LoggerFactory.getLogger(TakeProfitPlacer.class);

    private static final BigDecimal BELOW_BID = new BigDecimal("0.9999");
    private static final BigDecimal ABOVE_ASK = new BigDecimal("1.0001");

    private final ExchangeGateway exchangeGateway;
    private final GridStrategyEngine gridStrategyEngine;
    private final RiskManager riskManager;
    private final StateStore stateStore;
    private final GridBotProperties properties;

    public TakeProfitPlacer(
            ExchangeGateway exchangeGateway,
            GridStrategyEngine gridStrategyEngine,
            RiskManager riskManager,
            StateStore stateStore,
            GridBotProperties properties) {
        this.exchangeGateway = exchangeGateway;
        this.gridStrategyEngine = gridStrategyEngine;
        this.riskManager = riskManager;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    /**
     * @return the take-profit order id, or empty if it was skipped or rejected
     */
    public Optional<String> place(Execution fill, String profileName) {
        BigDecimal profitTarget = properties.getProfile(profileName).getProfitTarget();
        InstrumentSpec spec = gridStrategyEngine.getInstrumentSpec();
        OrderSide side = fill.getSide().opposite();

        BigDecimal target = side == OrderSide.SELL
                ? fill.getPrice().multiply(BigDecimal.ONE.add(profitTarget))
                : fill.getPrice().multiply(BigDecimal.ONE.subtract(profitTarget));
        BigDecimal price = PriceFormatter.formatPrice(target, spec.getTickSize());
        BigDecimal quantity = PriceFormatter.formatQuantity(fill.getQuantity(), spec.getQtyStep());
        log.info("{} filled @ {}, placing {} TP @ {}", fill.getSide(), fill.getPrice(), side, price);

        if (quantity.multiply(price).compareTo(spec.getMinNotional()) < 0) {
            log.warn("TP notional {} < min {}, skipping", quantity.multiply(price), spec.getMinNotional());
            return Optional.empty();
        }
        if (!riskManager.validateOrderSize(quantity, price)) {
            log.warn("TP {} @ {} exceeds the position size limit, skipping", quantity, price);
            return Optional.empty();
        }

        if (!riskManager.checkOrderAsMaker(side, price)) {
            Optional<BigDecimal> adjusted = outsideTouch(side, spec);
            if (adjusted.isEmpty()) {
                log.warn("TP at {} would be taker and the book is unavailable, skipping", price);
                return Optional.empty();
            }
            price = adjusted.get();
            log.info("Adjusted TP price to {}", price);
        }

        GatewayResult<String> result = exchangeGateway.placeOrder(OrderRequest.builder()
                .symbol(properties.getTrading().getSymbol())
                .side(side)
                .orderType(OrderType.LIMIT)
                .quantity(quantity)
                .price(price)
                .timeInForce(TimeInForce.POST_ONLY)
                .build());
        if (result.isFailure()) {
            log.error("Failed to place TP: {}", result.getError().message());
            return Optional.empty();
        }

        String orderId = result.getValue();
        stateStore.saveOrder(GridOrder.builder()
                .orderId(orderId)
                .symbol(properties.getTrading().getSymbol())
                .side(side)
                .price(price)
                .quantity(quantity)
                .orderType(OrderType.LIMIT.getExchangeValue())
                .status(OrderStatus.NEW)
                .gridLevel(0)
                .build());
        log.info("TP placed: {} {} @ {} (PostOnly)", side, quantity, price);
        return Optional.of(orderId);
    }

    private Optional<BigDecimal> outsideTouch(OrderSide side, InstrumentSpec spec) {
        GatewayResult<Ticker> ticker = exchangeGateway.getTicker(properties.getTrading().getSymbol());
        if (ticker.isFailure()) {
            return Optional.empty();
        }
        BigDecimal touch = side == OrderSide.BUY ? ticker.getValue().getBestBid() : ticker.getValue().getBestAsk();
        if (touch == null || touch.signum() <= 0) {
            log.warn("No {} side quote to move the TP behind", side == OrderSide.BUY ? "bid" : "ask");
            return Optional.empty();
        }
        BigDecimal raw = touch.multiply(side == OrderSide.BUY ? BELOW_BID : ABOVE_ASK);
        return Optional.of(PriceFormatter.formatPrice(raw, spec.getTickSize()));
    }
}
