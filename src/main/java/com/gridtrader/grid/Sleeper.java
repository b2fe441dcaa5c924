package com.gridtrader.grid;

import java.time.Duration;

/** Blocking pause used between exchange calls; tests substitute a no-op. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
