package com.gridtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Codes reported in {@code error.code} of an {@link com.gridtrader.api.dto.response.ApiErrorResponse},
 * each bound to the HTTP status it is served with.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(400),
    MALFORMED_REQUEST(400),
    UNKNOWN_PROFILE(400),
    CONFIG_NOT_FOUND(404),
    BOT_ALREADY_RUNNING(409),
    LOOPS_STILL_STOPPING(409),
    KILL_SWITCH_ACTIVE(423),
    INTERNAL_ERROR(500),
    GRID_SETUP_FAILED(502),
    EXCHANGE_ERROR(502);

    private final int httpStatus;

    public String getCode() {
        return name();
    }

    public boolean isServerError() {
        return httpStatus >= 500;
    }
}
