package com.makerhedge.exchange;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one exchange call: either a value or an {@link ExchangeError}, never both.
 *
 * @param <T> the payload type
 */
public final class ExchangeResult<T> {

    private final T value;
    private final ExchangeError error;

    private ExchangeResult(T value, ExchangeError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ExchangeResult<T> ok(T value) {
        return new ExchangeResult<>(value, null);
    }

    public static <T> ExchangeResult<T> failure(ExchangeError error) {
        return new ExchangeResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * Returns the payload.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Exchange call failed: " + error);
        }
        return value;
    }

    public ExchangeError getError() {
        if (error == null) {
            throw new IllegalStateException("Exchange call succeeded");
        }
        return error;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public <R> ExchangeResult<R> map(Function<T, R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(error);
    }

    @Override
    public String toString() {
        return isOk() ? "ExchangeResult[ok=" + value + "]" : "ExchangeResult[error=" + error + "]";
    }
}
