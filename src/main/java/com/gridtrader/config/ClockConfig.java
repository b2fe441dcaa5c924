package com.gridtrader.config;

import com.gridtrader.grid.Sleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * UTC clock shared by the grid engine, risk manager and state store, plus the blocking sleeper
 * the engine pauses with between order placements. Day rollover of the daily equity high is
 * evaluated against this clock; tests substitute a fixed one.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
