package com.gridtrader.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.domain.model.ExchangePosition;
import com.gridtrader.domain.model.Execution;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.OrderRequest;
import com.gridtrader.domain.model.Ticker;
import com.gridtrader.domain.model.WalletBalance;
import com.gridtrader.exception.ExchangeException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link ExchangeGateway} over the Bybit v5 Unified Trading Account API.
 *
 * <p>Delegates transport, signing, retry and rate limiting to {@link BybitRestClient} and
 * converts whatever escapes it ({@link ExchangeException}, Resilience4j's
 * {@code RequestNotPermitted}/{@code CallNotPermittedException}) into a failed
 * {@link GatewayResult}. All requests use the configured product category.
 */
@Service
public class BybitExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(BybitExchangeGateway.class);

    private static final int OPEN_ORDERS_LIMIT = 50;

    private final BybitRestClient restClient;
    private final BybitResponseParser parser;
    private final String category;
    private final String settleCoin;

    public BybitExchangeGateway(
            BybitRestClient restClient, BybitResponseParser parser, GridBotProperties properties) {
        this.restClient = restClient;
        this.parser = parser;
        this.category = properties.getTrading().getCategory();
        this.settleCoin = properties.getTrading().getSettleCoin();
    }

    // ========================
    // MARKET DATA
    // ========================

    @Override
    public GatewayResult<Ticker> getTicker(String symbol) {
        return call("getTicker", () -> {
            JsonNode result = restClient.getPublic("/v5/market/tickers", params("symbol", symbol));
            return parser.parseTicker(result).map(GatewayResult::ok).orElseGet(() -> emptyResponse("ticker"));
        });
    }

    @Override
    public GatewayResult<BigDecimal> getMarkPrice(String symbol) {
        GatewayResult<Ticker> ticker = getTicker(symbol);
        if (ticker.isFailure()) {
            return GatewayResult.failure(ticker.getError());
        }
        BigDecimal mark = ticker.getValue().getMarkPrice();
        if (mark == null || mark.signum() <= 0) {
            return emptyResponse("mark price");
        }
        return GatewayResult.ok(mark);
    }

    @Override
    public GatewayResult<InstrumentSpec> getInstrumentSpec(String symbol) {
        return call("getInstrumentSpec", () -> {
            JsonNode result = restClient.getPublic("/v5/market/instruments-info", params("symbol", symbol));
            return parser.parseInstrumentSpec(result)
                    .map(GatewayResult::ok)
                    .orElseGet(() -> emptyResponse("instrument info for " + symbol));
        });
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    public GatewayResult<List<ExchangeOrder>> getOpenOrders(String symbol) {
        return call("getOpenOrders", () -> {
            Map<String, String> params = params("symbol", symbol);
            params.put("limit", String.valueOf(OPEN_ORDERS_LIMIT));
            return GatewayResult.ok(parser.parseOrders(restClient.getPrivate("/v5/order/realtime", params)));
        });
    }

    @Override
    public GatewayResult<String> placeOrder(OrderRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category);
        body.put("symbol", request.getSymbol());
        body.put("side", request.getSide().getExchangeValue());
        body.put("orderType", request.getOrderType().getExchangeValue());
        body.put("qty", request.getQuantity().toPlainString());
        if (request.getPrice() != null) {
            body.put("price", request.getPrice().toPlainString());
        }
        body.put("timeInForce", request.getTimeInForce().getExchangeValue());
        body.put("positionIdx", 0);
        body.put("orderLinkId", request.getOrderLinkId() != null ? request.getOrderLinkId() : newOrderLinkId());

        return call("placeOrder", () -> {
            String orderId = parser.parseOrderId(restClient.submitOrder(body));
            if (orderId == null) {
                return emptyResponse("order id");
            }
            log.info(
                    "Order placed: orderId={} side={} qty={} price={}",
                    orderId,
                    request.getSide(),
                    request.getQuantity(),
                    request.getPrice());
            return GatewayResult.ok(orderId);
        });
    }

    @Override
    public GatewayResult<Void> cancelAllOrders(String symbol) {
        return call("cancelAllOrders", () -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("category", category);
            body.put("symbol", symbol);
            restClient.postPrivate("/v5/order/cancel-all", body);
            log.info("All orders cancelled for {}", symbol);
            return GatewayResult.ok(null);
        });
    }

    // ========================
    // ACCOUNT / POSITIONS
    // ========================

    @Override
    public GatewayResult<List<ExchangePosition>> getPositions(String symbol) {
        return call("getPositions", () -> {
            Map<String, String> params = params("symbol", symbol);
            params.put("settleCoin", settleCoin);
            return GatewayResult.ok(parser.parsePositions(restClient.getPrivate("/v5/position/list", params)));
        });
    }

    @Override
    public GatewayResult<WalletBalance> getWalletBalance() {
        return call("getWalletBalance", () -> {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("accountType", "UNIFIED");
            JsonNode result = restClient.getPrivate("/v5/account/wallet-balance", params);
            return parser.parseWalletBalance(result, settleCoin)
                    .map(GatewayResult::ok)
                    .orElseGet(() -> emptyResponse("wallet balance"));
        });
    }

    @Override
    public GatewayResult<List<Execution>> getExecutions(String symbol, int limit) {
        return call("getExecutions", () -> {
            Map<String, String> params = params("symbol", symbol);
            params.put("limit", String.valueOf(limit));
            return GatewayResult.ok(parser.parseExecutions(restClient.getPrivate("/v5/execution/list", params)));
        });
    }

    /** Treats Bybit's "leverage not modified" (110043) as success. */
    @Override
    public GatewayResult<Void> setLeverage(String symbol, int leverage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category);
        body.put("symbol", symbol);
        body.put("buyLeverage", String.valueOf(leverage));
        body.put("sellLeverage", String.valueOf(leverage));
        try {
            restClient.postPrivate("/v5/position/set-leverage", body);
            log.info("Leverage set to {}x for {}", leverage, symbol);
            return GatewayResult.ok(null);
        } catch (ExchangeException e) {
            if (e.getExchangeCode() == BybitRestClient.RET_LEVERAGE_NOT_MODIFIED) {
                log.info("Leverage already {}x for {}", leverage, symbol);
                return GatewayResult.ok(null);
            }
            log.error("setLeverage failed: {}", e.getMessage());
            return GatewayResult.failure(GatewayError.from(e));
        } catch (RuntimeException e) {
            log.error("setLeverage failed: {}", e.getMessage());
            return GatewayResult.failure(GatewayError.transport(e.getMessage()));
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private <T> GatewayResult<T> call(String operation, Supplier<GatewayResult<T>> body) {
        try {
            return body.get();
        } catch (ExchangeException e) {
            log.error("{} failed (code={}, retryable={}): {}", operation, e.getExchangeCode(), e.isRetryable(),
                    e.getMessage());
            return GatewayResult.failure(GatewayError.from(e));
        } catch (RuntimeException e) {
            // rate limiter / circuit breaker rejections and unexpected transport errors
            log.error("{} failed: {}", operation, e.getMessage());
            return GatewayResult.failure(GatewayError.transport(e.getMessage()));
        }
    }

    private Map<String, String> params(String key, String value) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("category", category);
        params.put(key, value);
        return params;
    }

    private static <T> GatewayResult<T> emptyResponse(String what) {
        return GatewayResult.failure(GatewayError.emptyResponse(what));
    }

    static String newOrderLinkId() {
        return "grid-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
