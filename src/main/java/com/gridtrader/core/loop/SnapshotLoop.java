package com.gridtrader.core.loop;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.core.engine.BotContext;
import com.gridtrader.domain.enums.PnlPeriod;
import com.gridtrader.domain.model.EquitySnapshot;
import com.gridtrader.domain.model.ExchangePosition;
import com.gridtrader.domain.model.WalletBalance;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.persistence.StateStore;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Records an equity snapshot and refreshes the 24h P&L summary on a fixed interval. */
public class SnapshotLoop extends PollingLoop {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoop.class);

    private final ExchangeGateway exchangeGateway;
    private final StateStore stateStore;
    private final GridBotProperties properties;

    public SnapshotLoop(
            BotContext context, ExchangeGateway exchangeGateway, StateStore stateStore, GridBotProperties properties) {
        super(context);
        this.exchangeGateway = exchangeGateway;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "snapshot service";
    }

    @Override
    protected Duration runIteration() {
        GatewayResult<WalletBalance> wallet = exchangeGateway.getWalletBalance();
        if (wallet.isFailure()) {
            log.warn("Snapshot skipped, wallet unavailable: {}", wallet.getError().message());
            return errorBackoff();
        }
        GatewayResult<List<ExchangePosition>> positions =
                exchangeGateway.getPositions(properties.getTrading().getSymbol());
        if (positions.isFailure()) {
            log.warn("Snapshot skipped, positions unavailable: {}", positions.getError().message());
            return errorBackoff();
        }

        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal positionsValue = BigDecimal.ZERO;
        for (ExchangePosition position : positions.getValue()) {
            if (!position.isOpen()) {
                continue;
            }
            if (position.getUnrealisedPnl() != null) {
                unrealized = unrealized.add(position.getUnrealisedPnl());
            }
            if (position.getPositionValue() != null) {
                positionsValue = positionsValue.add(position.getPositionValue());
            }
        }

        WalletBalance balance = wallet.getValue();
        stateStore.saveEquitySnapshot(EquitySnapshot.builder()
                .totalEquity(balance.getTotalEquity())
                .availableBalance(balance.getAvailableToWithdraw())
                .unrealizedPnl(unrealized)
                .totalPositionsValue(positionsValue)
                .build());
        stateStore.calculateAndSavePnl(PnlPeriod.LAST_24H);
        log.debug("Equity snapshot saved: equity={}, unrealized={}", balance.getTotalEquity(), unrealized);
        return properties.getMonitoring().getSnapshotInterval();
    }

    @Override
    protected Duration errorBackoff() {
        return properties.getMonitoring().getSnapshotErrorBackoff();
    }
}
