package com.conduitsystems.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for conditions that become true on another thread, such as a
 * supervisor finishing a restart or the router draining a subscription.
 *
 * <pre>{@code
 * AsyncAssertion.eventually(() -> node.childCount() == 0, Duration.ofSeconds(2));
 * AsyncAssertion.awaitValue(() -> child.state(), ChildState.RUNNING, Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    public static final long DEFAULT_POLL_INTERVAL_MS = 20;

    private AsyncAssertion() {
    }

    /**
     * Waits until {@code condition} holds.
     *
     * @throws AssertionError if it does not hold within {@code timeout}
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        RuntimeException lastError = null;

        do {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
                lastError = null;
            } catch (RuntimeException e) {
                lastError = e;
            }
            pause(pollIntervalMs);
        } while (System.nanoTime() < deadline);

        String message = "Condition did not become true within " + timeout;
        if (lastError != null) {
            throw new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
        }
        throw new AssertionError(message);
    }

    /**
     * Waits until {@code supplier} returns {@code expected}. The failure message lists
     * every distinct value seen while waiting.
     *
     * @return the matching value
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        List<T> seen = new ArrayList<>();

        do {
            T value = supplier.get();
            if (seen.isEmpty() || !Objects.equals(value, seen.get(seen.size() - 1))) {
                seen.add(value);
            }
            if (Objects.equals(expected, value)) {
                return value;
            }
            pause(DEFAULT_POLL_INTERVAL_MS);
        } while (System.nanoTime() < deadline);

        throw new AssertionError("Value did not become " + expected + " within " + timeout + ". Seen: " + seen);
    }

    /**
     * Re-runs {@code assertion} until it stops throwing.
     *
     * @throws AssertionError carrying the last failure if it never passes within {@code timeout}
     */
    public static void eventuallyAssert(Runnable assertion, Duration timeout) {
        Objects.requireNonNull(assertion, "assertion cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        Throwable lastError;

        do {
            try {
                assertion.run();
                return;
            } catch (AssertionError | RuntimeException e) {
                lastError = e;
            }
            pause(DEFAULT_POLL_INTERVAL_MS);
        } while (System.nanoTime() < deadline);

        throw new AssertionError("Assertion did not pass within " + timeout + ": " + lastError.getMessage(),
                lastError);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting", e);
        }
    }
}
