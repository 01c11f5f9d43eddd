package com.conduitsystems.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay curve applied before a restart, as a function of how many restarts already
 * happened in the current window.
 */
public sealed interface BackoffDelay permits BackoffDelay.Fixed, BackoffDelay.Exponential {

    /** Exponent ceiling; beyond this the cap applies anyway for any sane base. */
    int MAX_EXPONENT = 10;

    Duration delayFor(int priorRestarts);

    static BackoffDelay none() {
        return new Fixed(Duration.ZERO);
    }

    static BackoffDelay fixed(Duration delay) {
        return new Fixed(delay);
    }

    static BackoffDelay exponential(Duration base, double multiplier, Duration cap) {
        return new Exponential(base, multiplier, cap);
    }

    /**
     * The same delay before every restart.
     */
    record Fixed(Duration delay) implements BackoffDelay {
        public Fixed {
            Objects.requireNonNull(delay, "delay cannot be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        @Override
        public Duration delayFor(int priorRestarts) {
            return delay;
        }
    }

    /**
     * {@code min(base * multiplier^n, cap)}, with n capped at {@link #MAX_EXPONENT}.
     */
    record Exponential(Duration base, double multiplier, Duration cap) implements BackoffDelay {
        public Exponential {
            Objects.requireNonNull(base, "base cannot be null");
            Objects.requireNonNull(cap, "cap cannot be null");
            if (base.isNegative() || cap.isNegative()) {
                throw new IllegalArgumentException("base and cap must not be negative");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be at least 1.0, got " + multiplier);
            }
        }

        @Override
        public Duration delayFor(int priorRestarts) {
            int exponent = Math.min(Math.max(0, priorRestarts), MAX_EXPONENT);
            double millis = base.toMillis() * Math.pow(multiplier, exponent);
            long capped = (long) Math.min(millis, (double) cap.toMillis());
            return Duration.ofMillis(capped);
        }
    }
}
