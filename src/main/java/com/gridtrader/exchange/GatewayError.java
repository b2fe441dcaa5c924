package com.gridtrader.exchange;

import com.gridtrader.exception.ExchangeException;

/**
 * Failure half of a {@link GatewayResult}.
 *
 * @param code exchange return code as text, or a transport marker such as {@code TRANSPORT}
 * @param message human-readable cause
 * @param retryable true for transient failures worth retrying on a later cycle
 */
public record GatewayError(String code, String message, boolean retryable) {

    public static final String TRANSPORT = "TRANSPORT";
    public static final String EMPTY_RESPONSE = "EMPTY_RESPONSE";

    public static GatewayError from(ExchangeException e) {
        String code = e.getExchangeCode() >= 0 ? String.valueOf(e.getExchangeCode()) : TRANSPORT;
        return new GatewayError(code, e.getMessage(), e.isRetryable());
    }

    public static GatewayError transport(String message) {
        return new GatewayError(TRANSPORT, message, true);
    }

    public static GatewayError emptyResponse(String what) {
        return new GatewayError(EMPTY_RESPONSE, "Exchange returned no " + what, true);
    }
}
