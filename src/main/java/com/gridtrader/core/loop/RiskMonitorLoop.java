package com.gridtrader.core.loop;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.core.engine.BotContext;
import com.gridtrader.risk.KillSwitchService;
import com.gridtrader.risk.RiskManager;
import com.gridtrader.risk.RiskState;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes equity and exposure every cycle. A drawdown breach latches the kill switch inside
 * {@link RiskManager#updateEquityTracking()}; if trading is still running afterwards this loop
 * invokes the supplied stop action.
 */
public class RiskMonitorLoop extends PollingLoop {

    private static final Logger log = LoggerFactory.getLogger(RiskMonitorLoop.class);

    private final RiskManager riskManager;
    private final KillSwitchService killSwitchService;
    private final GridBotProperties.Monitoring monitoring;
    private final Runnable stopTrading;

    public RiskMonitorLoop(
            BotContext context,
            RiskManager riskManager,
            KillSwitchService killSwitchService,
            GridBotProperties properties,
            Runnable stopTrading) {
        super(context);
        this.riskManager = riskManager;
        this.killSwitchService = killSwitchService;
        this.monitoring = properties.getMonitoring();
        this.stopTrading = stopTrading;
    }

    @Override
    public String name() {
        return "risk monitor";
    }

    @Override
    protected Duration runIteration() {
        riskManager.updateEquityTracking();
        riskManager.checkMaxExposure();

        RiskState state = riskManager.getRiskState();
        log.debug(
                "Risk metrics: equity={}, dailyMax={}, exposure={}, drawdown={}",
                state.getTotalEquity(),
                state.getDailyMaxEquity(),
                state.getCurrentExposure(),
                state.drawdown());

        if (killSwitchService.isActive() && context.isRunning()) {
            log.error("Kill-switch active - stopping trading: {}", killSwitchService.getReason());
            stopTrading.run();
        }
        return monitoring.getRiskPollInterval();
    }

    @Override
    protected Duration errorBackoff() {
        return monitoring.getRiskErrorBackoff();
    }
}
