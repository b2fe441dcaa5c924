package com.gridtrader.core.loop;

import com.gridtrader.core.engine.BotContext;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for the monitoring loops. Each iteration is its own error boundary: an exception is
 * logged and the loop backs off instead of dying, so one failing loop never stops the others.
 *
 * <p>The loop exits when the shared {@link BotContext} stops running, after its current
 * iteration; in-flight exchange calls are not aborted.
 */
public abstract class PollingLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    protected final BotContext context;

    protected PollingLoop(BotContext context) {
        this.context = context;
    }

    /** Loop name for logs. */
    public abstract String name();

    /**
     * One pass of the loop body.
     *
     * @return how long to sleep before the next pass
     */
    protected abstract Duration runIteration();

    /** Sleep after an iteration threw. */
    protected abstract Duration errorBackoff();

    /**
     * Runs one iteration inside the error boundary.
     *
     * @return the pause before the next iteration
     */
    public Duration runOnce() {
        try {
            return runIteration();
        } catch (RuntimeException e) {
            log.error("Error in {}: {}", name(), e.getMessage(), e);
            return errorBackoff();
        }
    }

    @Override
    public final void run() {
        log.info("Starting {}...", name());
        while (context.isRunning()) {
            Duration next = runOnce();
            try {
                if (!context.pause(next)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("{} stopped", name());
    }
}
