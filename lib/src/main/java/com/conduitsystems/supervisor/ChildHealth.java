package com.conduitsystems.supervisor;

import java.util.Objects;

/**
 * Result of a child health check.
 */
public record ChildHealth(Status status, String reason) {

    public enum Status {
        HEALTHY,
        DEGRADED,
        FAILED
    }

    private static final ChildHealth HEALTHY = new ChildHealth(Status.HEALTHY, "");

    public ChildHealth {
        Objects.requireNonNull(status, "status cannot be null");
        reason = reason == null ? "" : reason;
    }

    public static ChildHealth healthy() {
        return HEALTHY;
    }

    public static ChildHealth degraded(String reason) {
        return new ChildHealth(Status.DEGRADED, reason);
    }

    public static ChildHealth failed(String reason) {
        return new ChildHealth(Status.FAILED, reason);
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
