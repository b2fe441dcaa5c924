package com.gridtrader.exception;

import java.util.Map;

/** A lifecycle request the bot cannot honour in its current state. */
public class BotStateException extends BaseException {

    private BotStateException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static BotStateException alreadyRunning(String profile) {
        return new BotStateException(
                ErrorCode.BOT_ALREADY_RUNNING, "Bot is already running", Map.of("profile", String.valueOf(profile)));
    }

    public static BotStateException killSwitchActive(String reason) {
        return new BotStateException(
                ErrorCode.KILL_SWITCH_ACTIVE,
                "Cannot start: kill switch is active",
                Map.of("reason", String.valueOf(reason)));
    }

    public static BotStateException loopsStillStopping() {
        return new BotStateException(
                ErrorCode.LOOPS_STILL_STOPPING, "Previous monitoring loops are still stopping", Map.of());
    }

    public static BotStateException gridSetupFailed(String profile) {
        return new BotStateException(
                ErrorCode.GRID_SETUP_FAILED, "Failed to setup grid", Map.of("profile", String.valueOf(profile)));
    }
}
