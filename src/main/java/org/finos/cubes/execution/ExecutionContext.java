package org.finos.cubes.execution;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Per-execution controls handed to a {@link DataStore}.
 *
 * @param timeout   Statement timeout; null for none
 * @param cancelled Checked before a statement runs and before its rows are
 *                  read; true aborts it. It does not interrupt a running
 *                  statement, use the timeout for that.
 */
public record ExecutionContext(
        Duration timeout,
        BooleanSupplier cancelled) {

    private static final ExecutionContext NONE = new ExecutionContext(null, () -> false);

    public ExecutionContext {
        Objects.requireNonNull(cancelled, "Cancellation signal cannot be null");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }

    public static ExecutionContext none() {
        return NONE;
    }

    public static ExecutionContext withTimeout(Duration timeout) {
        return new ExecutionContext(timeout, () -> false);
    }

    public ExecutionContext withCancellation(BooleanSupplier signal) {
        return new ExecutionContext(timeout, signal);
    }

    public Optional<Duration> findTimeout() {
        return Optional.ofNullable(timeout);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}
