package com.conduitsystems.supervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window restart counter for one child.
 *
 * <p>Restarts older than the window are pruned on every query, so the count decays back
 * to zero on its own once the child stays up for a full window. Not thread-safe: owned
 * and mutated by a single supervisor.
 */
public final class RestartBackoff {

    public static final int DEFAULT_MAX_RESTARTS = 5;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final BackoffDelay DEFAULT_DELAY =
            BackoffDelay.exponential(Duration.ofMillis(100), 2.0, Duration.ofSeconds(60));

    private final int maxRestarts;
    private final Duration window;
    private final BackoffDelay delay;
    private final Clock clock;
    private final Deque<Instant> restarts = new ArrayDeque<>();

    public RestartBackoff(int maxRestarts, Duration window, BackoffDelay delay, Clock clock) {
        if (maxRestarts <= 0) {
            throw new IllegalArgumentException("maxRestarts must be positive, got " + maxRestarts);
        }
        Objects.requireNonNull(window, "window cannot be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        this.maxRestarts = maxRestarts;
        this.window = window;
        this.delay = Objects.requireNonNull(delay, "delay cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public static RestartBackoff defaults() {
        return new RestartBackoff(DEFAULT_MAX_RESTARTS, DEFAULT_WINDOW, DEFAULT_DELAY, Clock.systemUTC());
    }

    /**
     * Records a restart happening now.
     *
     * @return how long to wait before starting the new instance
     */
    public Duration recordRestart() {
        prune();
        Duration wait = delay.delayFor(restarts.size());
        restarts.addLast(clock.instant());
        return wait;
    }

    /**
     * The delay the next restart would get, without recording anything.
     */
    public Duration calculateDelay() {
        prune();
        return delay.delayFor(restarts.size());
    }

    /**
     * False once the restarts within the window have reached the maximum.
     */
    public boolean shouldRestart() {
        prune();
        return restarts.size() < maxRestarts;
    }

    public boolean isLimitExceeded() {
        return !shouldRestart();
    }

    /**
     * Restarts within the current window.
     */
    public int restartCount() {
        prune();
        return restarts.size();
    }

    public void reset() {
        restarts.clear();
    }

    public int maxRestarts() {
        return maxRestarts;
    }

    public Duration window() {
        return window;
    }

    private void prune() {
        Instant cutoff = clock.instant().minus(window);
        while (!restarts.isEmpty() && !restarts.peekFirst().isAfter(cutoff)) {
            restarts.pollFirst();
        }
    }
}
