package com.gridtrader.exchange;

import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.domain.model.ExchangePosition;
import com.gridtrader.domain.model.Execution;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.OrderRequest;
import com.gridtrader.domain.model.Ticker;
import com.gridtrader.domain.model.WalletBalance;
import java.math.BigDecimal;
import java.util.List;

/**
 * Exchange operations consumed by the grid engine, risk manager and monitoring loops.
 *
 * <p>Every operation returns a {@link GatewayResult}; transport and exchange failures are
 * reported as failures, never thrown. Reads and cancel-all are safe to repeat. Order placement
 * is not: callers that retry a placement must resubmit the same {@link OrderRequest} so the
 * exchange can deduplicate on its {@code orderLinkId}.
 */
public interface ExchangeGateway {

    GatewayResult<Ticker> getTicker(String symbol);

    GatewayResult<BigDecimal> getMarkPrice(String symbol);

    GatewayResult<InstrumentSpec> getInstrumentSpec(String symbol);

    GatewayResult<List<ExchangeOrder>> getOpenOrders(String symbol);

    /** Submits an order and returns the exchange-assigned order id. */
    GatewayResult<String> placeOrder(OrderRequest request);

    GatewayResult<Void> cancelAllOrders(String symbol);

    GatewayResult<List<ExchangePosition>> getPositions(String symbol);

    GatewayResult<WalletBalance> getWalletBalance();

    /** Most recent executions first. */
    GatewayResult<List<Execution>> getExecutions(String symbol, int limit);

    GatewayResult<Void> setLeverage(String symbol, int leverage);

    default BigDecimal formatPrice(BigDecimal price, BigDecimal tickSize) {
        return PriceFormatter.formatPrice(price, tickSize);
    }

    default BigDecimal formatQuantity(BigDecimal quantity, BigDecimal qtyStep) {
        return PriceFormatter.formatQuantity(quantity, qtyStep);
    }
}
