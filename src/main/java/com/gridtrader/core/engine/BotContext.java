package com.gridtrader.core.engine;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Run state shared by the four monitoring loops: the running flag and the active profile.
 *
 * <p>Owned by {@link GridBotSupervisor} and handed to each loop at construction. Loops check
 * {@link #isRunning()} at the top of every iteration and sleep through {@link #pause}, which
 * returns early when {@link #stop()} is signalled.
 */
public class BotContext {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stopSignal = lock.newCondition();

    private volatile boolean running;
    private volatile String activeProfile;
    private volatile LocalDateTime startedAt;

    public BotContext(String activeProfile) {
        this.activeProfile = activeProfile;
    }

    /** @return false if already running */
    public boolean start(LocalDateTime now) {
        lock.lock();
        try {
            if (running) {
                return false;
            }
            running = true;
            startedAt = now;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Clears the running flag and wakes every sleeping loop. @return false if not running */
    public boolean stop() {
        lock.lock();
        try {
            if (!running) {
                return false;
            }
            running = false;
            stopSignal.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps for {@code duration} unless stopped first.
     *
     * @return true if still running after the pause
     */
    public boolean pause(Duration duration) throws InterruptedException {
        lock.lock();
        try {
            long remaining = duration.toNanos();
            while (running && remaining > 0) {
                remaining = stopSignal.awaitNanos(remaining);
            }
            return running;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public String getActiveProfile() {
        return activeProfile;
    }

    public void setActiveProfile(String activeProfile) {
        this.activeProfile = activeProfile;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }
}
