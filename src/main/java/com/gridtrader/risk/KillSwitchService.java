package com.gridtrader.risk;

import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.event.EventPublisherHelper;
import com.gridtrader.event.RiskEventType;
import com.gridtrader.exchange.GatewayResult;
import com.gridtrader.grid.GridStrategyEngine;
import com.gridtrader.persistence.StateStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drawdown kill switch: a latch that halts trading until an operator clears it.
 *
 * <p>States are Normal and Triggered. Activation cancels every resting order, writes a
 * CRITICAL event and publishes {@link RiskEventType#KILL_SWITCH_TRIGGERED}. Recovery of equity
 * never clears the latch; only {@link #deactivate()} does.
 *
 * <p><b>Idempotent:</b> the check-and-set runs under {@link #transitionLock}, so a second
 * activation neither cancels again nor overwrites the original reason. Cancellation goes
 * through {@link GridStrategyEngine#cancelAll()}, which waits for an in-flight rebuild to finish
 * before cancelling. The latch is registered with the engine as its halt check, so a rebuild
 * that starts or is mid-placement once the latch is set places nothing further.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final GridStrategyEngine gridStrategyEngine;
    private final StateStore stateStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicBoolean killSwitchActive = new AtomicBoolean(false);
    private final ReentrantLock transitionLock = new ReentrantLock();
    private volatile String killSwitchReason = "";
    private volatile LocalDateTime activatedAt;

    public KillSwitchService(
            GridStrategyEngine gridStrategyEngine,
            StateStore stateStore,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.gridStrategyEngine = gridStrategyEngine;
        this.stateStore = stateStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        gridStrategyEngine.registerHaltCheck(killSwitchActive::get);
    }

    // ========================
    // ACTIVATION
    // ========================

    /**
     * Latches the kill switch and cancels all resting orders.
     *
     * @param reason human-readable reason, kept until deactivation
     * @param details equity figures recorded with the event
     * @return the activation outcome; {@code activated=false} if the switch was already active
     */
    public KillSwitchResult activate(String reason, Map<String, Object> details) {
        LocalDateTime latchedAt;
        transitionLock.lock();
        try {
            if (killSwitchActive.get()) {
                log.warn("Kill switch already active, ignoring duplicate activation");
                return KillSwitchResult.alreadyActive(killSwitchReason, activatedAt);
            }
            killSwitchReason = reason;
            latchedAt = LocalDateTime.now(clock);
            activatedAt = latchedAt;
            killSwitchActive.set(true);
        } finally {
            transitionLock.unlock();
        }

        log.error("KILL SWITCH ACTIVATED: {}", reason);

        List<String> errors = new ArrayList<>();
        boolean cancelled = false;
        try {
            GatewayResult<Void> result = gridStrategyEngine.cancelAll();
            cancelled = result.isSuccess();
            if (cancelled) {
                log.info("All orders cancelled");
            } else {
                errors.add("Cancel all orders failed: " + result.getError().message());
            }
        } catch (RuntimeException e) {
            log.error("Error cancelling orders during kill switch activation", e);
            errors.add("Cancel all orders failed: " + e.getMessage());
        }

        Map<String, Object> eventDetails = details != null ? new HashMap<>(details) : new HashMap<>();
        eventDetails.put("ordersCancelled", cancelled);
        try {
            stateStore.logEvent(
                    BotEventType.KILL_SWITCH, EventSeverity.CRITICAL, "Kill-switch activated: " + reason, eventDetails);
        } catch (RuntimeException e) {
            log.error("Failed to record kill switch event", e);
            errors.add("Event log failed: " + e.getMessage());
        }

        eventPublisherHelper.publishRisk(
                this,
                RiskEventType.KILL_SWITCH_TRIGGERED,
                EventSeverity.CRITICAL,
                "Kill switch activated: " + reason,
                eventDetails);

        if (!errors.isEmpty()) {
            log.error("Kill switch completed with {} errors: {}", errors.size(), errors);
        }
        return KillSwitchResult.latched(reason, latchedAt, cancelled, errors);
    }

    // ========================
    // DEACTIVATION
    // ========================

    /**
     * Clears the latch. A no-op when the switch is not active.
     *
     * @return true if the switch was active and is now cleared
     */
    public boolean deactivate() {
        String previousReason;
        transitionLock.lock();
        try {
            if (!killSwitchActive.get()) {
                log.info("Kill switch not active, nothing to deactivate");
                return false;
            }
            previousReason = killSwitchReason;
            killSwitchActive.set(false);
            killSwitchReason = "";
            activatedAt = null;
        } finally {
            transitionLock.unlock();
        }

        log.info("Kill switch manually deactivated -- normal trading may resume");
        Map<String, Object> details = new HashMap<>();
        details.put("previousReason", previousReason);
        stateStore.logEvent(
                BotEventType.KILL_SWITCH_DEACTIVATED, EventSeverity.INFO, "Kill-switch deactivated manually", details);
        eventPublisherHelper.publishRisk(
                this, RiskEventType.KILL_SWITCH_DEACTIVATED, EventSeverity.INFO, "Kill switch deactivated", details);
        return true;
    }

    public boolean isActive() {
        return killSwitchActive.get();
    }

    public String getReason() {
        return killSwitchReason;
    }

    public LocalDateTime getActivatedAt() {
        return activatedAt;
    }
}
