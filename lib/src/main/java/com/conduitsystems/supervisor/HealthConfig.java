package com.conduitsystems.supervisor;

import java.time.Duration;

/**
 * Settings of a {@link HealthMonitor}.
 */
public class HealthConfig {

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;

    private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
    private Duration checkTimeout = DEFAULT_CHECK_TIMEOUT;
    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public HealthConfig setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
        return this;
    }

    public Duration getCheckTimeout() {
        return checkTimeout;
    }

    /**
     * A check that takes longer counts as failed.
     */
    public HealthConfig setCheckTimeout(Duration checkTimeout) {
        this.checkTimeout = checkTimeout;
        return this;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * Consecutive failed checks after which the child is treated as crashed.
     */
    public HealthConfig setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
        return this;
    }

    /**
     * @throws InvalidConfigurationException if any value is out of range
     */
    public void validate() {
        if (checkInterval == null || checkInterval.isNegative() || checkInterval.isZero()) {
            throw new InvalidConfigurationException("Health check interval must be positive");
        }
        if (checkTimeout == null || checkTimeout.isNegative() || checkTimeout.isZero()) {
            throw new InvalidConfigurationException("Health check timeout must be positive");
        }
        if (failureThreshold <= 0) {
            throw new InvalidConfigurationException("Health failure threshold must be positive");
        }
    }
}
