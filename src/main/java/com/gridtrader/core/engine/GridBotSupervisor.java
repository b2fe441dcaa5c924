package com.gridtrader.core.engine;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.core.loop.FillMonitorLoop;
import com.gridtrader.core.loop.GridMonitorLoop;
import com.gridtrader.core.loop.PollingLoop;
import com.gridtrader.core.loop.RiskMonitorLoop;
import com.gridtrader.core.loop.SnapshotLoop;
import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.model.ActiveConfig;
import com.gridtrader.domain.model.BotStatus;
import com.gridtrader.domain.model.ExchangePosition;
import com.gridtrader.domain.model.WalletBalance;
import com.gridtrader.event.EventPublisherHelper;
import com.gridtrader.event.RiskEvent;
import com.gridtrader.exception.BotStateException;
import com.gridtrader.exchange.ExchangeGateway;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.persistence.StateStore;
import com.gridtrader.risk.KillSwitchService;
import com.gridtrader.risk.RiskManager;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Owns the bot lifecycle and the four monitoring loops.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li><b>initialize</b>: loads the instrument spec, applies leverage, restores the active
 *       profile (or persists the default one)</li>
 *   <li><b>start</b>: refused while the kill switch is active; builds the ladder, then submits
 *       the fill, grid, risk and snapshot loops to {@code loopExecutor}</li>
 *   <li><b>stop</b>: clears the running flag, wakes the loops and cancels every resting order</li>
 * </ul>
 *
 * <p>The loops share one {@link BotContext} and the singleton engine, risk manager and kill
 * switch; the supervisor never builds competing copies. A kill switch activation stops
 * trading through {@link #onRiskEvent}.
 */
@Service
public class GridBotSupervisor {

    private static final Logger log = LoggerFactory.getLogger(GridBotSupervisor.class);

    private final GridStrategyEngine gridStrategyEngine;
    private final RiskManager riskManager;
    private final KillSwitchService killSwitchService;
    private final ExchangeGateway exchangeGateway;
    private final StateStore stateStore;
    private final TakeProfitPlacer takeProfitPlacer;
    private final EventPublisherHelper eventPublisherHelper;
    private final GridBotProperties properties;
    private final Clock clock;
    private final ThreadPoolTaskExecutor loopExecutor;

    private final BotContext context;
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final List<Future<?>> loopFutures = new ArrayList<>();

    public GridBotSupervisor(
            GridStrategyEngine gridStrategyEngine,
            RiskManager riskManager,
            KillSwitchService killSwitchService,
            ExchangeGateway exchangeGateway,
            StateStore stateStore,
            TakeProfitPlacer takeProfitPlacer,
            EventPublisherHelper eventPublisherHelper,
            GridBotProperties properties,
            Clock clock,
            @Qualifier("loopExecutor") ThreadPoolTaskExecutor loopExecutor) {
        this.gridStrategyEngine = gridStrategyEngine;
        this.riskManager = riskManager;
        this.killSwitchService = killSwitchService;
        this.exchangeGateway = exchangeGateway;
        this.stateStore = stateStore;
        this.takeProfitPlacer = takeProfitPlacer;
        this.eventPublisherHelper = eventPublisherHelper;
        this.properties = properties;
        this.clock = clock;
        this.loopExecutor = loopExecutor;
        this.context = new BotContext(properties.getTrading().getDefaultProfile());
    }

    // ========================
    // INITIALIZATION
    // ========================

    /**
     * Prepares the bot for trading. Failure to load the instrument spec propagates and aborts
     * startup.
     */
    public void initialize() {
        GridBotProperties.Trading trading = properties.getTrading();
        log.info("============================================================");
        log.info("Grid trading bot initializing");
        log.info("Symbol: {}", trading.getSymbol());
        log.info("Initial capital: {}", trading.getInitialCapital());
        log.info("============================================================");

        gridStrategyEngine.initialize();

        GatewayResult<Void> leverage = exchangeGateway.setLeverage(trading.getSymbol(), trading.getLeverage());
        if (leverage.isFailure()) {
            log.warn("Could not set leverage to {}x: {}", trading.getLeverage(), leverage.getError().message());
        } else {
            log.info("Leverage set to {}x", trading.getLeverage());
        }

        stateStore.getActiveConfig().ifPresentOrElse(
                config -> {
                    if (properties.getGrid().getProfiles().containsKey(config.getProfileName())) {
                        context.setActiveProfile(config.getProfileName());
                        log.info("Loaded active profile: {}", config.getProfileName());
                    } else {
                        log.warn(
                                "Stored profile {} is not configured, using {}",
                                config.getProfileName(),
                                context.getActiveProfile());
                        saveCurrentConfig();
                    }
                },
                this::saveCurrentConfig);
        log.info("All modules initialized, active profile {}", context.getActiveProfile());
    }

    // ========================
    // START / STOP
    // ========================

    /**
     * Builds the ladder and launches the monitoring loops.
     *
     * @throws BotStateException if already running, the kill switch is active, loops from the
     *     previous run are still finishing, or the ladder could not be built
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (context.isRunning()) {
                throw BotStateException.alreadyRunning(context.getActiveProfile());
            }
            if (killSwitchService.isActive()) {
                log.error("Cannot start: Kill-switch is active");
                throw BotStateException.killSwitchActive(killSwitchService.getReason());
            }
            if (loopFutures.stream().anyMatch(future -> !future.isDone())) {
                throw BotStateException.loopsStillStopping();
            }
            loopFutures.clear();

            String profile = context.getActiveProfile();
            log.info("Setting up grid with profile: {}", profile);
            if (!gridStrategyEngine.setupGrid(profile)) {
                throw BotStateException.gridSetupFailed(profile);
            }

            context.start(LocalDateTime.now(clock));
            for (PollingLoop loop : createLoops()) {
                loopFutures.add(loopExecutor.submit(loop));
            }
            stateStore.logEvent(
                    BotEventType.LIFECYCLE, EventSeverity.INFO, "Trading started", Map.of("profile", profile));
            log.info("Trading started successfully");
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the loops after their current iteration and cancels all resting orders.
     *
     * @return false if the bot was not running
     */
    public boolean stop() {
        lifecycleLock.lock();
        try {
            if (!context.stop()) {
                return false;
            }
            log.info("Stopping trading bot...");
            gridStrategyEngine.cancelAll();
            stateStore.logEvent(BotEventType.LIFECYCLE, EventSeverity.INFO, "Trading stopped", null);
            log.info("Trading stopped");
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    private List<PollingLoop> createLoops() {
        return List.of(
                new FillMonitorLoop(
                        context,
                        exchangeGateway,
                        gridStrategyEngine,
                        killSwitchService,
                        stateStore,
                        takeProfitPlacer,
                        eventPublisherHelper,
                        properties,
                        clock),
                new GridMonitorLoop(context, gridStrategyEngine, riskManager, killSwitchService, properties),
                new RiskMonitorLoop(context, riskManager, killSwitchService, properties, this::stop),
                new SnapshotLoop(context, exchangeGateway, stateStore, properties));
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        if (event.isKillSwitchTrigger() && context.isRunning()) {
            log.error("Kill-switch active - stopping trading");
            stop();
        }
    }

    // ========================
    // PROFILE
    // ========================

    /**
     * Switches the active profile, persists it and, when running, rebuilds the ladder with it.
     *
     * @throws com.gridtrader.exception.InvalidProfileException for an unknown profile; nothing
     *     changes in that case
     */
    public void changeProfile(String profileName) {
        properties.getProfile(profileName);
        String previous = context.getActiveProfile();
        log.info("Changing profile to: {}", profileName);
        context.setActiveProfile(profileName);
        saveCurrentConfig();
        stateStore.logEvent(
                BotEventType.PROFILE_CHANGED,
                EventSeverity.INFO,
                "Profile changed to " + profileName,
                Map.of("previous", previous, "profile", profileName));

        if (context.isRunning()) {
            gridStrategyEngine.recenterGrid("Profile changed to " + profileName, profileName);
        }
    }

    private void saveCurrentConfig() {
        String profileName = context.getActiveProfile();
        GridBotProperties.GridProfile profile = properties.getProfile(profileName);
        stateStore.saveConfig(ActiveConfig.builder()
                .profileName(profileName)
                .symbol(properties.getTrading().getSymbol())
                .gridSpacing(profile.getGridSpacing())
                .targetLevels(profile.getTargetLevels())
                .profitTarget(profile.getProfitTarget())
                .maxExposurePct(properties.getRisk().getMaxExposurePct())
                .leverage(properties.getTrading().getLeverage())
                .build());
    }

    // ========================
    // STATUS
    // ========================

    public BotStatus getStatus() {
        String symbol = properties.getTrading().getSymbol();
        BotStatus.BotStatusBuilder status = BotStatus.builder()
                .running(context.isRunning())
                .profile(context.getActiveProfile())
                .symbol(symbol)
                .grid(gridStrategyEngine.getGridStats())
                .risk(riskManager.getRiskMetrics())
                .trades24h(stateStore.countTrades(24))
                .startedAt(context.getStartedAt())
                .timestamp(LocalDateTime.now(clock));

        GatewayResult<WalletBalance> wallet = exchangeGateway.getWalletBalance();
        if (wallet.isSuccess()) {
            status.availableBalance(wallet.getValue().getAvailableToWithdraw())
                    .equity(wallet.getValue().getCoinEquity());
        }
        GatewayResult<List<ExchangePosition>> positions = exchangeGateway.getPositions(symbol);
        if (positions.isSuccess()) {
            status.openPositions((int) positions.getValue().stream().filter(ExchangePosition::isOpen).count());
        }
        return status.build();
    }

    public boolean isRunning() {
        return context.isRunning();
    }

    public String getActiveProfile() {
        return context.getActiveProfile();
    }

    // ========================
    // SHUTDOWN
    // ========================

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down bot...");
        if (context.isRunning()) {
            stop();
        }
        loopExecutor.shutdown();
        log.info("Shutdown complete");
    }
}
