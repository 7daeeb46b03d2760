package com.hiring.refnet.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an engine operation: either a success payload or one of the
 * {@link ReferralError} kinds with a human-readable message.
 *
 * <p>
 * Engines return a {@code Result} instead of throwing so that call sites handle
 * the failure kinds explicitly. Callers that prefer exceptions use
 * {@link #orElseThrow()}.
 *
 * @param <T> payload type
 */
public final class Result<T> {
    private final T value;
    private final ReferralError error;
    private final String message;

    private Result(T value, ReferralError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> fail(ReferralError error, String message) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return the payload
     * @throws IllegalStateException if this is a failure
     */
    public T value() {
        if (error != null)
            throw new IllegalStateException("No value on failed result: " + error + " (" + message + ")");
        return value;
    }

    /** @return the failure kind, or null on success */
    public ReferralError error() {
        return error;
    }

    /** @return the failure message, or null on success */
    public String message() {
        return message;
    }

    /**
     * Returns the payload, or throws {@link RefNetException} carrying the
     * failure kind.
     */
    public T orElseThrow() {
        if (error != null)
            throw new RefNetException(error, message);
        return value;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> fn) {
        if (error != null)
            return new Result<>(null, error, message);
        return new Result<>(fn.apply(value), null, null);
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> fn) {
        if (error != null)
            return new Result<>(null, error, message);
        return fn.apply(value);
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Failure[" + error + ": " + message + "]";
    }
}
