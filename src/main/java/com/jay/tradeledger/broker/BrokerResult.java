package com.jay.tradeledger.broker;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one broker call: a value or a classified {@link ApiError}, never both.
 */
public final class BrokerResult<T> {

    private final T value;
    private final ApiError error;

    private BrokerResult(T value, ApiError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> BrokerResult<T> ok(T value) {
        return new BrokerResult<>(value, null);
    }

    public static <T> BrokerResult<T> err(ApiError error) {
        return new BrokerResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isAuthExpired() {
        return error != null && error.isAuthExpired();
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<ApiError> error() {
        return Optional.ofNullable(error);
    }

    public <R> BrokerResult<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ok(fn.apply(value)) : err(error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
