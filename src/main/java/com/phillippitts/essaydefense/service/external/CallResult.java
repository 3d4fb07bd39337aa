package com.phillippitts.essaydefense.service.external;

import java.util.Objects;

/**
 * Typed result of a bounded external call.
 *
 * @param outcome  how the last attempt ended
 * @param value    the value on {@link Outcome#SUCCESS}, otherwise null
 * @param error    the last failure on {@link Outcome#ERROR}, otherwise null
 * @param attempts attempts made, including the successful one
 * @param <T> value type
 */
public record CallResult<T>(Outcome outcome, T value, Throwable error, int attempts) {

    public enum Outcome { SUCCESS, TIMEOUT, ERROR }

    public CallResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static <T> CallResult<T> success(T value, int attempts) {
        return new CallResult<>(Outcome.SUCCESS, value, null, attempts);
    }

    public static <T> CallResult<T> timeout(int attempts) {
        return new CallResult<>(Outcome.TIMEOUT, null, null, attempts);
    }

    public static <T> CallResult<T> error(Throwable error, int attempts) {
        return new CallResult<>(Outcome.ERROR, null, error, attempts);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
