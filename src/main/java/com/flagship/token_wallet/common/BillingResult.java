package com.flagship.token_wallet.common;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a billing operation.
 *
 * Expected failures (insufficient funds, frozen wallet, idempotency conflict and so on)
 * travel as a {@link BillingError} instead of an exception. Exceptions stay reserved for
 * programming errors and infrastructure failures.
 *
 * @param <T> type of the success value
 */
public final class BillingResult<T> {

    private final T value;
    private final BillingError error;

    private BillingResult(T value, BillingError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> BillingResult<T> success(T value) {
        return new BillingResult<>(value, null);
    }

    public static <T> BillingResult<T> failure(BillingError error) {
        return new BillingResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> BillingResult<T> failure(ErrorCode code, String message) {
        return failure(BillingError.of(code, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public boolean hasError(ErrorCode code) {
        return error != null && error.getCode() == code;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException(
                String.format("No value present, result failed with %s: %s", error.getCode(), error.getMessage()));
        }
        return value;
    }

    public BillingError getError() {
        return error;
    }

    public <U> BillingResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return new BillingResult<>(null, error);
        }
        return new BillingResult<>(mapper.apply(value), null);
    }

    /**
     * Re-types a failed result so it can be returned from a method with a different value type.
     */
    public <U> BillingResult<U> asFailure() {
        if (error == null) {
            throw new IllegalStateException("Cannot convert a successful result into a failure");
        }
        return new BillingResult<>(null, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "BillingResult[success=" + value + "]" : "BillingResult[failure=" + error + "]";
    }
}
