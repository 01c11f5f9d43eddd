package com.conduitsystems.supervisor;

import java.time.Duration;

/**
 * A child did not stop gracefully in time and was forcibly terminated.
 */
public class ShutdownTimeoutException extends SupervisorException {

    private final Duration timeout;

    public ShutdownTimeoutException(String childName, Duration timeout) {
        super("Child '" + childName + "' did not stop within " + timeout.toMillis() + "ms", childName);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
