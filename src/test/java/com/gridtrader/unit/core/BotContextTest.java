package com.gridtrader.unit.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.gridtrader.core.engine.BotContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BotContextTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    @Test
    @DisplayName("start and stop report whether the state changed")
    void startStop_transitions() {
        BotContext context = new BotContext("Normal");

        assertThat(context.start(NOW)).isTrue();
        assertThat(context.start(NOW)).isFalse();
        assertThat(context.getStartedAt()).isEqualTo(NOW);
        assertThat(context.stop()).isTrue();
        assertThat(context.stop()).isFalse();
        assertThat(context.isRunning()).isFalse();
    }

    @Test
    @DisplayName("pause returns immediately when not running")
    void pauseWhenStopped_returnsFalse() throws Exception {
        BotContext context = new BotContext("Normal");

        assertThat(context.pause(Duration.ofMinutes(5))).isFalse();
    }

    @Test
    @DisplayName("A sleeping loop wakes as soon as stop is signalled")
    void stop_wakesPausedLoop() throws Exception {
        BotContext context = new BotContext("Normal");
        context.start(NOW);

        CompletableFuture<Boolean> paused = CompletableFuture.supplyAsync(() -> {
            try {
                return context.pause(Duration.ofMinutes(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        Thread.sleep(100);
        context.stop();

        assertThat(paused.get(2, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    @DisplayName("Active profile can be switched at runtime")
    void activeProfile_switchable() {
        BotContext context = new BotContext("Normal");
        context.setActiveProfile("Aggressive");

        assertThat(context.getActiveProfile()).isEqualTo("Aggressive");
    }
}
