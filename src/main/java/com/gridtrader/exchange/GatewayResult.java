package com.gridtrader.exchange;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-failure outcome of an {@link ExchangeGateway} call.
 *
 * <p>Gateway operations never throw for exchange or transport problems; callers check
 * {@link #isSuccess()} before reading {@link #getValue()}.
 */
public final class GatewayResult<T> {

    private final T value;
    private final GatewayError error;

    private GatewayResult(T value, GatewayError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> GatewayResult<T> ok(T value) {
        return new GatewayResult<>(value, null);
    }

    public static <T> GatewayResult<T> failure(GatewayError error) {
        return new GatewayResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed gateway result: " + error.message());
        }
        return value;
    }

    public GatewayError getError() {
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public <R> GatewayResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "GatewayResult[ok=" + value + "]" : "GatewayResult[error=" + error + "]";
    }
}
