package com.gridtrader.exchange;

import com.gridtrader.exception.ExchangeException;
import java.util.function.Predicate;

/**
 * Resilience4j retry predicate for the {@code bybitApi} instance: only exchange failures flagged
 * retryable (timeouts, connection errors, rate limits, 5xx) are retried. Rejections such as
 * invalid parameters or insufficient balance are returned to the caller on the first attempt.
 */
public class TransientExchangeFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ExchangeException e && e.isRetryable();
    }
}
