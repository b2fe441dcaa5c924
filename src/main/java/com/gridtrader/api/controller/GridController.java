package com.gridtrader.api.controller;

import com.gridtrader.api.dto.response.GridLevelsResponse;
import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.exception.ExchangeException;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayError;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.grid.GridStrategyEngine;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint for the current ladder.
 *
 * <p>GET /api/grid -- engine stats plus the open orders as the exchange reports them.
 */
@RestController
@RequestMapping("/api/grid")
public class GridController {

    private final GridStrategyEngine gridStrategyEngine;
    private final ExchangeGateway exchangeGateway;
    private final GridBotProperties properties;

    public GridController(
            GridStrategyEngine gridStrategyEngine, ExchangeGateway exchangeGateway, GridBotProperties properties) {
        this.gridStrategyEngine = gridStrategyEngine;
        this.exchangeGateway = exchangeGateway;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<GridLevelsResponse> getGrid() {
        String symbol = properties.getTrading().getSymbol();
        GatewayResult<List<ExchangeOrder>> orders = exchangeGateway.getOpenOrders(symbol);
        if (orders.isFailure()) {
            GatewayError error = orders.getError();
            throw new ExchangeException(-1, "Failed to fetch open orders: " + error.message(), error.retryable());
        }
        List<ExchangeOrder> open = orders.getValue();
        BigDecimal currentPrice = gridStrategyEngine.fetchCurrentPrice().orElse(null);

        return ResponseEntity.ok(GridLevelsResponse.builder()
                .stats(gridStrategyEngine.getGridStats())
                .currentPrice(currentPrice)
                .buyOrders(open.stream()
                        .filter(order -> order.getSide() == OrderSide.BUY)
                        .sorted(Comparator.comparing(ExchangeOrder::getPrice).reversed())
                        .collect(Collectors.toList()))
                .sellOrders(open.stream()
                        .filter(order -> order.getSide() == OrderSide.SELL)
                        .sorted(Comparator.comparing(ExchangeOrder::getPrice))
                        .collect(Collectors.toList()))
                .totalOrders(open.size())
                .build());
    }
}
