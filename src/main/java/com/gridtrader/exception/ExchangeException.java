package com.gridtrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Raised by the exchange transport when a request fails.
 *
 * <p>{@code retryable} separates transient failures (timeouts, connection resets, rate limits,
 * exchange-side 5xx) from terminal ones where the exchange understood and refused the request.
 * Only retryable failures are retried by the Resilience4j {@code bybitApi} instance.
 */
@Getter
public class ExchangeException extends BaseException {

    /** Exchange return code, or -1 when the failure happened before a response was parsed. */
    private final int exchangeCode;

    private final boolean retryable;

    public ExchangeException(int exchangeCode, String message, boolean retryable) {
        super(ErrorCode.EXCHANGE_ERROR, message, Map.of("exchangeCode", exchangeCode, "retryable", retryable));
        this.exchangeCode = exchangeCode;
        this.retryable = retryable;
    }

    public ExchangeException(String message, Throwable cause, boolean retryable) {
        super(ErrorCode.EXCHANGE_ERROR, message, Map.of("retryable", retryable), cause);
        this.exchangeCode = -1;
        this.retryable = retryable;
    }
}
