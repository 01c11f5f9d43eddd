package com.conduitsystems.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * How a child is stopped.
 *
 * @param kind graceful, immediate or unbounded
 * @param timeout grace period, only meaningful for {@link Kind#GRACEFUL}
 */
public record ShutdownPolicy(Kind kind, Duration timeout) {

    public enum Kind {
        /** Ask the child to stop, force it after the timeout. */
        GRACEFUL,
        /** Terminate without asking. */
        IMMEDIATE,
        /** Wait as long as the child needs. */
        INFINITY
    }

    public static final ShutdownPolicy DEFAULT = graceful(Duration.ofSeconds(5));

    public ShutdownPolicy {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static ShutdownPolicy graceful(Duration timeout) {
        return new ShutdownPolicy(Kind.GRACEFUL, timeout);
    }

    public static ShutdownPolicy immediate() {
        return new ShutdownPolicy(Kind.IMMEDIATE, Duration.ZERO);
    }

    public static ShutdownPolicy infinity() {
        return new ShutdownPolicy(Kind.INFINITY, Duration.ZERO);
    }
}
