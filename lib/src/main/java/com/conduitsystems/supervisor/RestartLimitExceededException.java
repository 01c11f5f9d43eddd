package com.conduitsystems.supervisor;

import java.time.Duration;

/**
 * A child used up its restart budget and is now permanently failed.
 */
public class RestartLimitExceededException extends SupervisorException {

    private final int maxRestarts;
    private final Duration window;

    public RestartLimitExceededException(String childName, int maxRestarts, Duration window) {
        super("Child '" + childName + "' exceeded " + maxRestarts + " restarts within " + window.toMillis() + "ms",
                childName);
        this.maxRestarts = maxRestarts;
        this.window = window;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }

    public Duration getWindow() {
        return window;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
