package com.supplyradar.rpc;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value obtained over RPC or an explicit "unavailable" marker with the reason.
 * Unavailable is an expected outcome after the retry budget is spent, not an error.
 */
public final class RpcOutcome<T> {

    private final T value;
    private final String reason;

    private RpcOutcome(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> RpcOutcome<T> available(T value) {
        return new RpcOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> RpcOutcome<T> unavailable(String reason) {
        return new RpcOutcome<>(null, reason != null ? reason : "unknown");
    }

    public boolean isAvailable() {
        return value != null;
    }

    public boolean isUnavailable() {
        return value == null;
    }

    /**
     * @throws IllegalStateException when unavailable
     */
    public T get() {
        if (value == null) {
            throw new IllegalStateException("RPC outcome unavailable: " + reason);
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Reason for an unavailable outcome; null when available.
     */
    public String reason() {
        return reason;
    }

    public <R> RpcOutcome<R> flatMap(Function<? super T, RpcOutcome<R>> mapper) {
        if (value == null) {
            return unavailable(reason);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return value != null ? "Available[" + value + "]" : "Unavailable[" + reason + "]";
    }
}
