package com.conduitsystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates every thread and executor the runtime uses, so that sizing and naming are
 * tuned in one place.
 */
public class ThreadPoolFactory {

    public static final int DEFAULT_SCHEDULER_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    public static final int DEFAULT_FIXED_POOL_SIZE = Runtime.getRuntime().availableProcessors();

    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;

    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = DEFAULT_FIXED_POOL_SIZE;
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Kinds of worker pools.
     */
    public enum ThreadPoolType {
        /**
         * Grows on demand and reuses idle threads. Suits child start/stop calls, which
         * may block until their timeout.
         */
        CACHED,

        /**
         * A fixed number of threads. Good for CPU-bound work with a known optimal size.
         */
        FIXED,

        /**
         * A work-stealing pool for mixed workloads.
         */
        WORK_STEALING
    }

    public ThreadPoolFactory() {
    }

    /**
     * Creates a worker pool of the configured type.
     *
     * @param poolName Name prefix for the threads in this pool
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case CACHED:
                return Executors.newCachedThreadPool(createThreadFactory(poolName + "-worker"));
            case FIXED:
                return Executors.newFixedThreadPool(fixedPoolSize, createThreadFactory(poolName + "-worker"));
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        return Executors.newScheduledThreadPool(schedulerThreads, createThreadFactory(poolName + "-scheduler"));
    }

    /**
     * Creates a thread factory for dedicated long-running threads (router, actor loops).
     *
     * @param prefix The prefix for thread names
     */
    public ThreadFactory createThreadFactory(String prefix) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return runnable -> {
            Thread thread = useNamedThreads
                    ? new Thread(runnable, prefix + "-" + threadNumber.getAndIncrement())
                    : new Thread(runnable);
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    // Getters and setters

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        if (schedulerThreads <= 0) {
            throw new IllegalArgumentException("schedulerThreads must be positive");
        }
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        if (fixedPoolSize <= 0) {
            throw new IllegalArgumentException("fixedPoolSize must be positive");
        }
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        if (workStealingParallelism <= 0) {
            throw new IllegalArgumentException("workStealingParallelism must be positive");
        }
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }
}
