package com.conduitsystems.supervisor;

import com.conduitsystems.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically probes the children of a {@link SupervisorNode} and treats a child that
 * fails {@link HealthConfig#getFailureThreshold()} checks in a row as crashed.
 * Degraded results neither count as failures nor reset the streak.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    private final SupervisorNode node;
    private final HealthConfig config;
    private final ScheduledExecutorService scheduler;
    private final Map<ChildId, Integer> consecutiveFailures = new ConcurrentHashMap<>();
    private final AtomicLong checksPerformed = new AtomicLong();
    private volatile boolean closed;

    HealthMonitor(SupervisorNode node, HealthConfig config, ThreadPoolFactory threadPoolFactory) {
        this.node = node;
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                threadPoolFactory.createThreadFactory("health-" + node.name()));
    }

    void start() {
        long interval = config.getCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::checkAll, interval, interval, TimeUnit.MILLISECONDS);
        logger.debug("Health checks for supervisor {} every {}ms", node.name(), interval);
    }

    /**
     * Runs one round of checks over all children. Called by the schedule; exposed so a
     * round can be forced without waiting for the interval.
     */
    public void checkAll() {
        if (closed || node.state() != SupervisorState.RUNNING) {
            return;
        }
        try {
            List<ChildId> ids = node.childIds();
            consecutiveFailures.keySet().retainAll(ids);
            for (ChildId id : ids) {
                if (closed) {
                    return;
                }
                check(id);
            }
        } catch (SupervisorException e) {
            // the node went down between rounds
            logger.debug("Health round for {} skipped: {}", node.name(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Health round for supervisor {} failed", node.name(), e);
        }
    }

    private void check(ChildId id) {
        Optional<SupervisorNode.HealthReading> result = node.readHealth(id, config.getCheckTimeout());
        if (result.isEmpty()) {
            return;
        }
        checksPerformed.incrementAndGet();
        ChildHealth health = result.get().health();

        switch (health.status()) {
            case HEALTHY:
                consecutiveFailures.remove(id);
                break;
            case DEGRADED:
                break;
            case FAILED:
                int failures = consecutiveFailures.merge(id, 1, Integer::sum);
                logger.debug("Child {} of {} failed health check ({} in a row): {}", id, node.name(), failures,
                        health.reason());
                if (failures >= config.getFailureThreshold()) {
                    consecutiveFailures.remove(id);
                    String childName = node.child(id).map(ChildStatus::name).orElse(id.toString());
                    logger.warn("Child {} of {} failed {} health checks, restarting", childName, node.name(),
                            failures);
                    try {
                        node.handleChildFailure(id, result.get().generation(),
                                new HealthCheckFailedException(childName, failures, health.reason()));
                    } catch (SupervisorException e) {
                        logger.warn("Recovery of unhealthy child {} failed: {}", childName, e.getMessage());
                    }
                }
                break;
            default:
                break;
        }
    }

    public int consecutiveFailures(ChildId childId) {
        return consecutiveFailures.getOrDefault(childId, 0);
    }

    public long checksPerformed() {
        return checksPerformed.get();
    }

    public HealthConfig config() {
        return config;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        scheduler.shutdownNow();
    }
}
