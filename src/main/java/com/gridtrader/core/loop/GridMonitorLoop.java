package com.gridtrader.core.loop;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.core.engine.BotContext;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.grid.RecenterDecision;
import com.gridtrader.risk.KillSwitchService;
import com.gridtrader.risk.RiskManager;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the recenter conditions each cycle and rebuilds the ladder when one fires, unless
 * the exposure gate is closed.
 */
public class GridMonitorLoop extends PollingLoop {

    private static final Logger log = LoggerFactory.getLogger(GridMonitorLoop.class);

    private final GridStrategyEngine gridStrategyEngine;
    private final RiskManager riskManager;
    private final KillSwitchService killSwitchService;
    private final GridBotProperties.Monitoring monitoring;

    public GridMonitorLoop(
            BotContext context,
            GridStrategyEngine gridStrategyEngine,
            RiskManager riskManager,
            KillSwitchService killSwitchService,
            GridBotProperties properties) {
        super(context);
        this.gridStrategyEngine = gridStrategyEngine;
        this.riskManager = riskManager;
        this.killSwitchService = killSwitchService;
        this.monitoring = properties.getMonitoring();
    }

    @Override
    public String name() {
        return "grid monitor";
    }

    @Override
    protected Duration runIteration() {
        if (killSwitchService.isActive()) {
            return monitoring.getKillSwitchIdleInterval();
        }

        RecenterDecision decision = gridStrategyEngine.shouldRecenter();
        if (!decision.triggered()) {
            return monitoring.getGridPollInterval();
        }

        log.info("Recenter triggered [{}]: {}", decision.trigger(), decision.reason());
        if (!riskManager.checkMaxExposure()) {
            log.warn("Skipping recenter: max exposure exceeded");
            return monitoring.getExposureSkipBackoff();
        }

        if (gridStrategyEngine.recenterGrid(decision.reason(), context.getActiveProfile())) {
            log.info("Grid recentered successfully");
        } else {
            log.error("Failed to recenter grid");
        }
        return monitoring.getGridPollInterval();
    }

    @Override
    protected Duration errorBackoff() {
        return monitoring.getGridErrorBackoff();
    }
}
