package com.gridtrader.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.domain.model.ExchangePosition;
import com.gridtrader.domain.model.Execution;
import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.domain.model.Ticker;
import com.gridtrader.domain.model.WalletBalance;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts Bybit v5 {@code result} payloads into domain objects.
 *
 * <p>Bybit encodes every number as a string and uses the empty string for "not applicable";
 * both missing and blank numeric fields parse as zero. List endpoints return
 * {@code {"list": [...]}}; single-item lookups take the first element.
 */
@Component
public class BybitResponseParser {

    private static final Logger log = LoggerFactory.getLogger(BybitResponseParser.class);

    public Optional<Ticker> parseTicker(JsonNode result) {
        return first(result).map(t -> Ticker.builder()
                .symbol(t.path("symbol").asText())
                .bestBid(decimal(t, "bid1Price"))
                .bestAsk(decimal(t, "ask1Price"))
                .markPrice(decimal(t, "markPrice"))
                .lastPrice(decimal(t, "lastPrice"))
                .build());
    }

    /**
     * Reads lotSizeFilter/priceFilter. Defaults follow Bybit's linear contract minimums when a
     * field is absent: qty 1, step 1, notional 5, tick 0.0001.
     */
    public Optional<InstrumentSpec> parseInstrumentSpec(JsonNode result) {
        return first(result).map(i -> {
            JsonNode lot = i.path("lotSizeFilter");
            JsonNode priceFilter = i.path("priceFilter");
            return InstrumentSpec.builder()
                    .symbol(i.path("symbol").asText())
                    .minOrderQty(decimalOr(lot, "minOrderQty", BigDecimal.ONE))
                    .qtyStep(decimalOr(lot, "qtyStep", BigDecimal.ONE))
                    .minNotional(decimalOr(lot, "minNotionalValue", new BigDecimal("5")))
                    .tickSize(decimalOr(priceFilter, "tickSize", new BigDecimal("0.0001")))
                    .build();
        });
    }

    public List<ExchangeOrder> parseOrders(JsonNode result) {
        List<ExchangeOrder> orders = new ArrayList<>();
        for (JsonNode o : result.path("list")) {
            orders.add(ExchangeOrder.builder()
                    .orderId(o.path("orderId").asText())
                    .orderLinkId(o.path("orderLinkId").asText(null))
                    .symbol(o.path("symbol").asText())
                    .side(OrderSide.fromExchange(o.path("side").asText()))
                    .price(decimal(o, "price"))
                    .quantity(decimal(o, "qty"))
                    .filledQuantity(decimal(o, "cumExecQty"))
                    .status(OrderStatus.fromExchange(o.path("orderStatus").asText(null)))
                    .build());
        }
        return orders;
    }

    public List<ExchangePosition> parsePositions(JsonNode result) {
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode p : result.path("list")) {
            positions.add(ExchangePosition.builder()
                    .symbol(p.path("symbol").asText())
                    .side(OrderSide.fromExchange(p.path("side").asText()))
                    .size(decimal(p, "size"))
                    .entryPrice(decimal(p, "avgPrice"))
                    .markPrice(decimal(p, "markPrice"))
                    .positionValue(decimal(p, "positionValue"))
                    .unrealisedPnl(decimal(p, "unrealisedPnl"))
                    .leverage(decimal(p, "leverage").intValue())
                    .build());
        }
        return positions;
    }

    public Optional<WalletBalance> parseWalletBalance(JsonNode result, String settleCoin) {
        return first(result).map(w -> {
            WalletBalance.WalletBalanceBuilder builder = WalletBalance.builder()
                    .totalEquity(decimal(w, "totalEquity"))
                    .totalAvailableBalance(decimal(w, "totalAvailableBalance"))
                    .totalPerpUpl(decimal(w, "totalPerpUPL"))
                    .coin(settleCoin)
                    .coinEquity(BigDecimal.ZERO)
                    .availableToWithdraw(BigDecimal.ZERO);
            for (JsonNode c : w.path("coin")) {
                if (settleCoin.equals(c.path("coin").asText())) {
                    builder.coinEquity(decimal(c, "equity"))
                            .availableToWithdraw(decimal(c, "availableToWithdraw"));
                }
            }
            return builder.build();
        });
    }

    public List<Execution> parseExecutions(JsonNode result) {
        List<Execution> executions = new ArrayList<>();
        for (JsonNode e : result.path("list")) {
            executions.add(Execution.builder()
                    .execId(e.path("execId").asText())
                    .orderId(e.path("orderId").asText())
                    .symbol(e.path("symbol").asText())
                    .side(OrderSide.fromExchange(e.path("side").asText()))
                    .price(decimal(e, "execPrice"))
                    .quantity(decimal(e, "execQty"))
                    .fee(decimal(e, "execFee"))
                    .feeCurrency(e.path("feeCurrency").asText("USDT"))
                    .maker(e.path("isMaker").asBoolean(true))
                    .executedAt(timestamp(e, "execTime"))
                    .build());
        }
        return executions;
    }

    public String parseOrderId(JsonNode result) {
        String orderId = result.path("orderId").asText("");
        return orderId.isEmpty() ? null : orderId;
    }

    // ========================
    // FIELD HELPERS
    // ========================

    private Optional<JsonNode> first(JsonNode result) {
        JsonNode list = result == null ? null : result.path("list");
        if (list == null || !list.isArray() || list.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(list.get(0));
    }

    static BigDecimal decimal(JsonNode node, String field) {
        return decimalOr(node, field, BigDecimal.ZERO);
    }

    static BigDecimal decimalOr(JsonNode node, String field, BigDecimal fallback) {
        String text = node.path(field).asText("");
        if (text.isBlank()) {
            return fallback;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            log.warn("Unparseable {} value '{}', using {}", field, text, fallback);
            return fallback;
        }
    }

    private static LocalDateTime timestamp(JsonNode node, String field) {
        long millis = node.path(field).asLong(0);
        if (millis <= 0) {
            return null;
        }
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }
}
