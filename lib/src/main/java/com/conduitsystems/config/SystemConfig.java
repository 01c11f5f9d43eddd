package com.conduitsystems.config;

import com.conduitsystems.backpressure.BackpressureStrategy;
import com.conduitsystems.monitoring.BrokerEvent;
import com.conduitsystems.monitoring.Monitor;
import com.conduitsystems.monitoring.NoopMonitor;
import com.conduitsystems.monitoring.SupervisionEvent;
import com.conduitsystems.supervisor.InvalidConfigurationException;

import java.time.Duration;

/**
 * Configuration of an actor system: actor mailboxes, timeouts, limits and the monitors
 * that receive broker and supervision events.
 */
public class SystemConfig {
    // Default values for system configuration
    public static final int DEFAULT_MAILBOX_CAPACITY = 1000;
    public static final BackpressureStrategy DEFAULT_BACKPRESSURE_STRATEGY = BackpressureStrategy.BLOCK;
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SPAWN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ACTORS = 0;
    public static final int DEFAULT_DEAD_LETTER_CAPACITY = 1000;
    public static final int DEFAULT_BATCH_SIZE = 10;

    private int mailboxCapacity = DEFAULT_MAILBOX_CAPACITY;
    private BackpressureStrategy backpressureStrategy = DEFAULT_BACKPRESSURE_STRATEGY;
    private Duration sendTimeout = DEFAULT_SEND_TIMEOUT;
    private Duration spawnTimeout = DEFAULT_SPAWN_TIMEOUT;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    private int maxActors = DEFAULT_MAX_ACTORS;
    private int deadLetterCapacity = DEFAULT_DEAD_LETTER_CAPACITY;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Monitor<BrokerEvent> brokerMonitor = NoopMonitor.instance();
    private Monitor<SupervisionEvent> supervisionMonitor = NoopMonitor.instance();
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();

    /**
     * Sets the capacity of each actor mailbox.
     *
     * @param mailboxCapacity The capacity, must be positive
     * @return This SystemConfig instance
     */
    public SystemConfig setMailboxCapacity(int mailboxCapacity) {
        this.mailboxCapacity = mailboxCapacity;
        return this;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    /**
     * Sets what happens when a message is routed to a full mailbox.
     *
     * @param backpressureStrategy The strategy
     * @return This SystemConfig instance
     */
    public SystemConfig setBackpressureStrategy(BackpressureStrategy backpressureStrategy) {
        this.backpressureStrategy = backpressureStrategy;
        return this;
    }

    public BackpressureStrategy getBackpressureStrategy() {
        return backpressureStrategy;
    }

    /**
     * Sets how long a {@link BackpressureStrategy#BLOCK} mailbox waits for room.
     *
     * @param sendTimeout The timeout
     * @return This SystemConfig instance
     */
    public SystemConfig setSendTimeout(Duration sendTimeout) {
        this.sendTimeout = sendTimeout;
        return this;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    /**
     * Sets how long an actor may take to start, including its handler's preStart.
     *
     * @param spawnTimeout The timeout
     * @return This SystemConfig instance
     */
    public SystemConfig setSpawnTimeout(Duration spawnTimeout) {
        this.spawnTimeout = spawnTimeout;
        return this;
    }

    public Duration getSpawnTimeout() {
        return spawnTimeout;
    }

    /**
     * Sets how long an actor may take to finish its current message when stopped.
     *
     * @param shutdownTimeout The timeout
     * @return This SystemConfig instance
     */
    public SystemConfig setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Sets the maximum number of live actors.
     *
     * @param maxActors The limit, 0 for none
     * @return This SystemConfig instance
     */
    public SystemConfig setMaxActors(int maxActors) {
        this.maxActors = maxActors;
        return this;
    }

    public int getMaxActors() {
        return maxActors;
    }

    public SystemConfig setDeadLetterCapacity(int deadLetterCapacity) {
        this.deadLetterCapacity = deadLetterCapacity;
        return this;
    }

    public int getDeadLetterCapacity() {
        return deadLetterCapacity;
    }

    /**
     * Sets how many messages an actor takes from its mailbox at once.
     *
     * @param batchSize The batch size, must be positive
     * @return This SystemConfig instance
     */
    public SystemConfig setBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public SystemConfig setBrokerMonitor(Monitor<BrokerEvent> brokerMonitor) {
        this.brokerMonitor = brokerMonitor;
        return this;
    }

    public Monitor<BrokerEvent> getBrokerMonitor() {
        return brokerMonitor;
    }

    public SystemConfig setSupervisionMonitor(Monitor<SupervisionEvent> supervisionMonitor) {
        this.supervisionMonitor = supervisionMonitor;
        return this;
    }

    public Monitor<SupervisionEvent> getSupervisionMonitor() {
        return supervisionMonitor;
    }

    public SystemConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    /**
     * @throws InvalidConfigurationException if any value is out of range
     */
    public void validate() {
        if (mailboxCapacity <= 0) {
            throw new InvalidConfigurationException("Mailbox capacity must be positive");
        }
        if (backpressureStrategy == null) {
            throw new InvalidConfigurationException("Backpressure strategy cannot be null");
        }
        requirePositive(sendTimeout, "Send timeout");
        requirePositive(spawnTimeout, "Spawn timeout");
        requirePositive(shutdownTimeout, "Shutdown timeout");
        if (maxActors < 0) {
            throw new InvalidConfigurationException("Max actors cannot be negative");
        }
        if (deadLetterCapacity <= 0) {
            throw new InvalidConfigurationException("Dead letter capacity must be positive");
        }
        if (batchSize <= 0) {
            throw new InvalidConfigurationException("Batch size must be positive");
        }
        if (brokerMonitor == null || supervisionMonitor == null || threadPoolFactory == null) {
            throw new InvalidConfigurationException("Monitors and thread pool factory cannot be null");
        }
    }

    private static void requirePositive(Duration value, String what) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new InvalidConfigurationException(what + " must be positive");
        }
    }
}
