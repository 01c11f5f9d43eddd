package com.conduitsystems.supervisor;

import com.conduitsystems.config.ThreadPoolFactory;
import com.conduitsystems.monitoring.Monitor;
import com.conduitsystems.monitoring.NoopMonitor;
import com.conduitsystems.monitoring.SupervisionEvent;

import java.time.Clock;

/**
 * Settings of a {@link SupervisorNode}.
 */
public class SupervisorConfig {

    public static final SupervisionStrategy DEFAULT_STRATEGY = SupervisionStrategy.ONE_FOR_ONE;

    private String name = "supervisor";
    private SupervisionStrategy strategy = DEFAULT_STRATEGY;
    private Monitor<SupervisionEvent> monitor = NoopMonitor.instance();
    private boolean escalateOnLimitExceeded = false;
    private HealthConfig healthConfig;
    private Clock clock = Clock.systemUTC();
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();

    public static SupervisorConfig named(String name) {
        return new SupervisorConfig().setName(name);
    }

    public String getName() {
        return name;
    }

    public SupervisorConfig setName(String name) {
        this.name = name;
        return this;
    }

    public SupervisionStrategy getStrategy() {
        return strategy;
    }

    public SupervisorConfig setStrategy(SupervisionStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public Monitor<SupervisionEvent> getMonitor() {
        return monitor;
    }

    public SupervisorConfig setMonitor(Monitor<SupervisionEvent> monitor) {
        this.monitor = monitor;
        return this;
    }

    public boolean isEscalateOnLimitExceeded() {
        return escalateOnLimitExceeded;
    }

    /**
     * When a child exhausts its restart budget, report the supervisor itself as failed
     * to its parent, which then restarts the whole subtree.
     */
    public SupervisorConfig setEscalateOnLimitExceeded(boolean escalateOnLimitExceeded) {
        this.escalateOnLimitExceeded = escalateOnLimitExceeded;
        return this;
    }

    /**
     * @return the health check settings, or null if health checks are off
     */
    public HealthConfig getHealthConfig() {
        return healthConfig;
    }

    public SupervisorConfig setHealthConfig(HealthConfig healthConfig) {
        this.healthConfig = healthConfig;
        return this;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Clock behind restart windows and event timestamps.
     */
    public SupervisorConfig setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public SupervisorConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    /**
     * @throws InvalidConfigurationException if any value is missing or out of range
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Supervisor name must not be blank");
        }
        if (strategy == null || monitor == null || clock == null || threadPoolFactory == null) {
            throw new InvalidConfigurationException("Supervisor " + name + " has a missing setting");
        }
        if (healthConfig != null) {
            healthConfig.validate();
        }
    }
}
