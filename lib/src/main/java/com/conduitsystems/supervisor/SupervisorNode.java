package com.conduitsystems.supervisor;

import com.conduitsystems.monitoring.Monitor;
import com.conduitsystems.monitoring.Monitors;
import com.conduitsystems.monitoring.SupervisionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Owns a set of children, restarts them according to a {@link SupervisionStrategy} and
 * their backoff budgets, and records what it does to a {@link Monitor}.
 *
 * <p>All supervision state (the child map and start order) is touched only by the node's
 * own thread: public operations are queued onto it and wait for the result. Child
 * {@code start}/{@code stop} calls run on a separate worker pool so their timeouts can be
 * enforced.
 *
 * <p>A node is itself a {@link Child}, so it can be supervised by another node. Stopping
 * it as a child stops its children but keeps their specs; starting it again brings the
 * whole subtree back up with fresh restart budgets.
 */
public class SupervisorNode implements Child {

    private static final Logger logger = LoggerFactory.getLogger(SupervisorNode.class);

    /** Matches whichever instance is current; generations start at 1. */
    static final long ANY_GENERATION = 0;

    /**
     * A health check result together with the incarnation it was taken from.
     */
    record HealthReading(long generation, ChildHealth health) {
    }

    private record Incarnation(Child instance, long generation) {
    }

    private final String name;
    private final SupervisionStrategy strategy;
    private final Monitor<SupervisionEvent> monitor;
    private final boolean escalateOnLimitExceeded;
    private final SupervisorConfig config;
    private final Clock clock;
    private final ExecutorService nodeExecutor;
    private final ExecutorService workers;

    // node thread only
    private final Map<ChildId, ChildHandle> children = new HashMap<>();
    private final List<ChildId> startOrder = new ArrayList<>();

    private volatile Thread nodeThread;
    private volatile SupervisorState state = SupervisorState.RUNNING;
    private volatile ChildContext parentContext;
    private volatile HealthMonitor healthMonitor;

    public SupervisorNode(SupervisorConfig config) {
        config.validate();
        this.config = config;
        this.name = config.getName();
        this.strategy = config.getStrategy();
        this.monitor = config.getMonitor();
        this.escalateOnLimitExceeded = config.isEscalateOnLimitExceeded();
        this.clock = config.getClock();

        ThreadFactory nodeThreads = config.getThreadPoolFactory().createThreadFactory("supervisor-" + name);
        this.nodeExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = nodeThreads.newThread(runnable);
            nodeThread = thread;
            return thread;
        });
        this.workers = config.getThreadPoolFactory().createExecutorService("supervisor-" + name);

        if (config.getHealthConfig() != null) {
            enableHealthChecks(config.getHealthConfig());
        }
        logger.debug("Supervisor {} created with strategy {}", name, strategy);
    }

    // ---------------------------------------------------------------- public API

    /**
     * Builds the child from the spec's factory, starts it and appends it to the start
     * order.
     *
     * @throws ChildStartException if the factory failed or the child did not start in time
     * @throws InvalidConfigurationException if a child with the same name already exists
     */
    public ChildId startChild(ChildSpec spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        ensureRunning();
        return onNode(() -> doStartChild(spec));
    }

    /**
     * Starts a batch of children that share default settings.
     */
    public ChildBatch childBatch() {
        return new ChildBatch(this);
    }

    /**
     * Stops the child according to its shutdown policy and removes it.
     *
     * @throws ChildNotFoundException if no such child exists
     * @throws ShutdownTimeoutException if the child had to be forcibly terminated
     * @throws ChildStopException if the child's stop failed
     */
    public void stopChild(ChildId childId) {
        ensureRunning();
        onNode(() -> {
            ChildHandle handle = require(childId);
            children.remove(childId);
            startOrder.remove(childId);
            doStop(handle);
            return null;
        });
    }

    /**
     * Replaces the child with a fresh instance. Manual restarts do not consume the restart
     * budget; they reset it, which also revives a permanently failed child.
     */
    public void restartChild(ChildId childId) {
        ensureRunning();
        onNode(() -> {
            ChildHandle handle = require(childId);
            stopQuietly(handle);
            handle.backoff().reset();
            launch(handle);
            handle.recordRestart(clock.instant());
            record(event(SupervisionEvent.Kind.CHILD_RESTARTED, handle)
                    .put("restartCount", handle.restartCount())
                    .put("manual", true));
            return null;
        });
    }

    /**
     * Applies the restart policy, the strategy and the backoff budgets to a crashed child.
     *
     * @return what was done
     * @throws ChildNotFoundException if no such child exists
     * @throws RestartLimitExceededException if a targeted child ran out of restarts (it is
     *         left permanently failed; other targets were still processed)
     * @throws ChildStartException if a restarted child could not be started again
     */
    public SupervisionDecision handleChildFailure(ChildId childId, Throwable error) {
        return handleChildFailure(childId, ANY_GENERATION, error);
    }

    /**
     * As {@link #handleChildFailure(ChildId, Throwable)}, but ignored if the child has been
     * replaced since the given incarnation.
     */
    SupervisionDecision handleChildFailure(ChildId childId, long generation, Throwable error) {
        Objects.requireNonNull(error, "error cannot be null");
        ensureRunning();
        return onNode(() -> doHandleTermination(childId, generation, error));
    }

    /**
     * Handles a child that finished normally. Only permanent children are restarted.
     */
    public SupervisionDecision handleChildExit(ChildId childId) {
        ensureRunning();
        return onNode(() -> doHandleTermination(childId, ANY_GENERATION, null));
    }

    /**
     * Stops every child in reverse start order and shuts the node down. Idempotent.
     *
     * @throws SupervisorException the first stop error; any further ones are suppressed
     */
    public void shutdown() {
        synchronized (this) {
            if (state != SupervisorState.RUNNING) {
                return;
            }
            state = SupervisorState.SHUTTING_DOWN;
        }
        logger.info("Shutting down supervisor {}", name);

        HealthMonitor health = healthMonitor;
        if (health != null) {
            health.close();
        }

        List<SupervisorException> errors;
        try {
            errors = onNode(() -> stopAll(true));
        } finally {
            state = SupervisorState.STOPPED;
            nodeExecutor.shutdown();
            workers.shutdownNow();
        }
        logger.info("Supervisor {} stopped", name);
        throwCollected(errors);
    }

    /**
     * Status of every child, in start order.
     */
    public Map<ChildId, ChildStatus> healthSnapshot() {
        if (state == SupervisorState.STOPPED) {
            return Map.of();
        }
        return onNode(() -> {
            Map<ChildId, ChildStatus> snapshot = new LinkedHashMap<>();
            for (ChildId id : startOrder) {
                snapshot.put(id, children.get(id).status());
            }
            return Collections.unmodifiableMap(snapshot);
        });
    }

    public Optional<ChildStatus> child(ChildId childId) {
        return onNode(() -> Optional.ofNullable(children.get(childId)).map(ChildHandle::status));
    }

    public Optional<ChildId> findChild(String childName) {
        return onNode(() -> startOrder.stream()
                .filter(id -> children.get(id).name().equals(childName))
                .findFirst());
    }

    /**
     * Child ids in start order.
     */
    public List<ChildId> childIds() {
        return onNode(() -> List.copyOf(startOrder));
    }

    public int childCount() {
        return onNode(startOrder::size);
    }

    /**
     * Runs the child's health check (bounded by {@code timeout}) and records the result.
     *
     * @return the result, or empty if the child is not running
     */
    public Optional<ChildHealth> checkChildHealth(ChildId childId, Duration timeout) {
        return readHealth(childId, timeout).map(HealthReading::health);
    }

    Optional<HealthReading> readHealth(ChildId childId, Duration timeout) {
        Incarnation incarnation = onNode(() -> {
            ChildHandle handle = require(childId);
            return handle.state().isRunning() && handle.instance() != null
                    ? new Incarnation(handle.instance(), handle.generation()) : null;
        });
        if (incarnation == null) {
            return Optional.empty();
        }
        Child instance = incarnation.instance();

        ChildHealth health;
        Future<ChildHealth> check = workers.submit(instance::healthCheck);
        try {
            health = check.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (health == null) {
                health = ChildHealth.failed("health check returned nothing");
            }
        } catch (TimeoutException e) {
            check.cancel(true);
            health = ChildHealth.failed("health check timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            health = ChildHealth.failed("health check threw " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }

        ChildHealth result = health;
        onNode(() -> {
            ChildHandle handle = children.get(childId);
            // ignore results for an instance that was replaced meanwhile
            if (handle != null && handle.generation() == incarnation.generation() && handle.instance() == instance) {
                handle.lastHealth(result);
                if (result.status() == ChildHealth.Status.DEGRADED) {
                    record(event(SupervisionEvent.Kind.HEALTH_DEGRADED, handle).put("reason", result.reason()));
                } else if (result.isFailed()) {
                    record(event(SupervisionEvent.Kind.HEALTH_CHECK_FAILED, handle).put("reason", result.reason()));
                }
            }
            return null;
        });
        return Optional.of(new HealthReading(incarnation.generation(), result));
    }

    /**
     * Starts periodic health checks of all children.
     */
    public synchronized HealthMonitor enableHealthChecks(HealthConfig healthConfig) {
        healthConfig.validate();
        if (healthMonitor != null) {
            healthMonitor.close();
        }
        HealthMonitor monitor = new HealthMonitor(this, healthConfig, config.getThreadPoolFactory());
        monitor.start();
        healthMonitor = monitor;
        return monitor;
    }

    /**
     * @throws HealthMonitoringNotEnabledException if health checks are off
     */
    public synchronized void disableHealthChecks() {
        healthMonitor().close();
        healthMonitor = null;
    }

    /**
     * @throws HealthMonitoringNotEnabledException if health checks are off
     */
    public HealthMonitor healthMonitor() {
        HealthMonitor monitor = healthMonitor;
        if (monitor == null) {
            throw new HealthMonitoringNotEnabledException(name);
        }
        return monitor;
    }

    public String name() {
        return name;
    }

    public SupervisionStrategy strategy() {
        return strategy;
    }

    public SupervisorState state() {
        return state;
    }

    // ---------------------------------------------------------------- Child contract

    /**
     * Starts every retained child that is not running, with a fresh restart budget.
     */
    @Override
    public void start() {
        ensureRunning();
        List<SupervisorException> errors = onNode(() -> {
            List<SupervisorException> failures = new ArrayList<>();
            for (ChildId id : startOrder) {
                ChildHandle handle = children.get(id);
                if (handle.instance() != null && handle.state().isRunning()) {
                    continue;
                }
                handle.backoff().reset();
                try {
                    launch(handle);
                } catch (SupervisorException e) {
                    failures.add(e);
                }
            }
            return failures;
        });
        throwCollected(errors);
    }

    /**
     * Stops every child in reverse start order, keeping their specs.
     */
    @Override
    public void stop(Duration timeout) {
        if (state != SupervisorState.RUNNING) {
            return;
        }
        throwCollected(onNode(() -> stopAll(false)));
    }

    @Override
    public void terminate() {
        try {
            nodeExecutor.execute(() -> {
                for (ChildHandle handle : children.values()) {
                    terminateQuietly(handle);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Supervisor {} already shut down, nothing to terminate", name);
        }
    }

    /**
     * Failed if a child is permanently failed, degraded if one is not running.
     */
    @Override
    public ChildHealth healthCheck() {
        if (state != SupervisorState.RUNNING) {
            return ChildHealth.failed("supervisor " + name + " is " + state);
        }
        return onNode(() -> {
            for (ChildId id : startOrder) {
                ChildHandle handle = children.get(id);
                if (handle.state() == ChildState.PERMANENTLY_FAILED) {
                    return ChildHealth.failed("child " + handle.name() + " permanently failed");
                }
            }
            for (ChildId id : startOrder) {
                ChildHandle handle = children.get(id);
                if (!handle.state().isRunning()) {
                    return ChildHealth.degraded("child " + handle.name() + " is " + handle.state());
                }
            }
            return ChildHealth.healthy();
        });
    }

    @Override
    public void attach(ChildContext context) {
        this.parentContext = context;
    }

    // ---------------------------------------------------------------- node thread

    private ChildId doStartChild(ChildSpec spec) {
        for (ChildHandle existing : children.values()) {
            if (existing.name().equals(spec.name())) {
                throw new InvalidConfigurationException(
                        "Supervisor " + name + " already has a child named '" + spec.name() + "'");
            }
        }
        RestartBackoff backoff = new RestartBackoff(spec.maxRestarts(), spec.restartWindow(), spec.backoffDelay(),
                clock);
        ChildHandle handle = new ChildHandle(ChildId.random(), spec, backoff);
        launch(handle);
        children.put(handle.id(), handle);
        startOrder.add(handle.id());
        return handle.id();
    }

    /**
     * Builds a fresh instance from the spec and starts it within the start timeout.
     */
    private void launch(ChildHandle handle) {
        ChildSpec spec = handle.spec();
        handle.state(ChildState.STARTING);

        Child instance;
        try {
            instance = spec.factory().get();
        } catch (RuntimeException e) {
            handle.state(ChildState.FAILED);
            record(event(SupervisionEvent.Kind.CHILD_FAILED, handle).put("error", e).put("phase", "factory"));
            throw new ChildStartException(spec.name(), "factory failed: " + e.getMessage(), e);
        }
        if (instance == null) {
            handle.state(ChildState.FAILED);
            throw new ChildStartException(spec.name(), "factory returned null", null);
        }

        instance.attach(new ChildContext(handle.id(), handle.nextGeneration(), spec.name(), name, this::report));
        handle.instance(instance);

        Future<?> starting = workers.submit(() -> {
            instance.start();
            return null;
        });
        try {
            starting.get(spec.startTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            starting.cancel(true);
            startFailed(handle, instance, "did not start within " + spec.startTimeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            startFailed(handle, instance, String.valueOf(e.getCause().getMessage()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            startFailed(handle, instance, "interrupted", e);
        }

        handle.state(ChildState.RUNNING);
        handle.startedAt(clock.instant());
        logger.debug("Supervisor {} started child {}", name, spec.name());
        record(event(SupervisionEvent.Kind.CHILD_STARTED, handle));
    }

    private void startFailed(ChildHandle handle, Child instance, String reason, Throwable cause) {
        handle.state(ChildState.FAILED);
        handle.instance(null);
        terminateQuietly(instance);
        record(event(SupervisionEvent.Kind.CHILD_FAILED, handle).put("error", reason).put("phase", "start"));
        throw new ChildStartException(handle.name(), reason, cause);
    }

    private SupervisionDecision doHandleTermination(ChildId childId, long generation, Throwable error) {
        ChildHandle handle = require(childId);
        if (state != SupervisorState.RUNNING || handle.state().isTerminal()) {
            logger.debug("Supervisor {} ignoring report for {} in state {}", name, handle.name(), handle.state());
            return SupervisionDecision.ignore();
        }
        if (generation != ANY_GENERATION && generation != handle.generation()) {
            logger.debug("Supervisor {} ignoring stale report for {} (generation {}, current {})", name,
                    handle.name(), generation, handle.generation());
            return SupervisionDecision.ignore();
        }

        boolean abnormal = error != null;
        if (abnormal) {
            handle.state(ChildState.FAILED);
            logger.warn("Supervisor {}: child {} failed: {}", name, handle.name(), error.toString());
            record(event(SupervisionEvent.Kind.CHILD_FAILED, handle)
                    .put("error", error)
                    .put("restartCount", handle.restartCount()));
        } else {
            logger.debug("Supervisor {}: child {} exited normally", name, handle.name());
        }

        if (!handle.spec().restartPolicy().shouldRestart(abnormal)) {
            stopQuietly(handle);
            if (handle.spec().restartPolicy() == RestartPolicy.TEMPORARY) {
                children.remove(childId);
                startOrder.remove(childId);
            }
            return SupervisionDecision.stop(childId);
        }

        List<ChildId> targets = strategy.restartTargets(childId, startOrder);
        record(SupervisionEvent.builder(name, SupervisionEvent.Kind.STRATEGY_APPLIED)
                .timestamp(clock.instant())
                .child(childId)
                .put("strategy", strategy)
                .put("affectedCount", targets.size())
                .put("failedChild", handle.name())
                .build());

        for (int i = targets.size() - 1; i >= 0; i--) {
            stopQuietly(children.get(targets.get(i)));
        }

        List<SupervisorException> errors = new ArrayList<>();
        for (ChildId target : targets) {
            ChildHandle targetHandle = children.get(target);
            if (targetHandle.state() == ChildState.PERMANENTLY_FAILED && !target.equals(childId)) {
                continue;
            }
            restartWithBackoff(targetHandle, errors);
        }
        throwCollected(errors);
        return new SupervisionDecision(strategy.directive(), targets);
    }

    /**
     * Restarts the child, waiting out its backoff delay first. Start failures are retried
     * while the budget lasts; an exhausted budget leaves the child permanently failed.
     */
    private void restartWithBackoff(ChildHandle handle, List<SupervisorException> errors) {
        RestartBackoff backoff = handle.backoff();
        while (true) {
            if (!backoff.shouldRestart()) {
                limitExceeded(handle, errors);
                return;
            }
            Duration delay = backoff.recordRestart();
            handle.state(ChildState.RESTARTING);
            if (!delay.isZero()) {
                logger.debug("Supervisor {} restarting {} in {}ms", name, handle.name(), delay.toMillis());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    handle.state(ChildState.FAILED);
                    errors.add(new ChildStartException(handle.name(), "interrupted during backoff", e));
                    return;
                }
            }
            try {
                launch(handle);
            } catch (ChildStartException e) {
                logger.warn("Supervisor {}: restart of {} failed: {}", name, handle.name(), e.getMessage());
                continue;
            }
            handle.recordRestart(clock.instant());
            logger.info("Supervisor {} restarted child {} (restart #{})", name, handle.name(), handle.restartCount());
            record(event(SupervisionEvent.Kind.CHILD_RESTARTED, handle)
                    .put("restartCount", handle.restartCount())
                    .put("delayMs", delay.toMillis()));
            return;
        }
    }

    private void limitExceeded(ChildHandle handle, List<SupervisorException> errors) {
        RestartBackoff backoff = handle.backoff();
        terminateQuietly(handle);
        handle.state(ChildState.PERMANENTLY_FAILED);
        logger.error("Supervisor {}: child {} exceeded {} restarts within {}ms, giving up", name, handle.name(),
                backoff.maxRestarts(), backoff.window().toMillis());
        record(event(SupervisionEvent.Kind.RESTART_LIMIT_EXCEEDED, handle)
                .put("restartCount", backoff.restartCount())
                .put("maxRestarts", backoff.maxRestarts())
                .put("windowMs", backoff.window().toMillis()));

        RestartLimitExceededException error = new RestartLimitExceededException(handle.name(),
                backoff.maxRestarts(), backoff.window());
        errors.add(error);
        if (escalateOnLimitExceeded) {
            escalate(error);
        }
    }

    private void escalate(SupervisorException error) {
        ChildContext context = parentContext;
        if (context == null) {
            logger.warn("Supervisor {} has no parent to escalate {} to", name, error.getMessage());
            return;
        }
        logger.info("Supervisor {} escalating to {}: {}", name, context.supervisorName(), error.getMessage());
        context.reportFailure(error);
    }

    /**
     * Stops the child per its shutdown policy. The child always ends up stopped; errors
     * are thrown afterwards.
     */
    private void doStop(ChildHandle handle) {
        Child instance = handle.instance();
        if (instance == null) {
            if (!handle.state().isTerminal()) {
                handle.state(ChildState.STOPPED);
            }
            return;
        }

        ChildSpec spec = handle.spec();
        ShutdownPolicy policy = spec.shutdownPolicy();
        handle.state(ChildState.STOPPING);
        try {
            switch (policy.kind()) {
                case IMMEDIATE:
                    instance.terminate();
                    break;
                case GRACEFUL:
                    Duration timeout = policy.timeout().compareTo(spec.shutdownTimeout()) < 0
                            ? policy.timeout() : spec.shutdownTimeout();
                    awaitStop(handle, instance, timeout, timeout);
                    break;
                case INFINITY:
                    awaitStop(handle, instance, spec.shutdownTimeout(), null);
                    break;
                default:
                    throw new IllegalStateException("Unknown shutdown policy: " + policy.kind());
            }
        } finally {
            handle.state(ChildState.STOPPED);
            handle.instance(null);
            handle.startedAt(null);
            logger.debug("Supervisor {} stopped child {}", name, handle.name());
            record(event(SupervisionEvent.Kind.CHILD_STOPPED, handle));
        }
    }

    /**
     * @param hint the timeout passed to the child's own stop
     * @param limit how long to wait, null for no limit
     */
    private void awaitStop(ChildHandle handle, Child instance, Duration hint, Duration limit) {
        Future<?> stopping = workers.submit(() -> {
            instance.stop(hint);
            return null;
        });
        try {
            if (limit == null) {
                stopping.get();
            } else {
                stopping.get(limit.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            stopping.cancel(true);
            terminateQuietly(instance);
            record(event(SupervisionEvent.Kind.SHUTDOWN_TIMEOUT, handle).put("timeoutMs", limit.toMillis()));
            throw new ShutdownTimeoutException(handle.name(), limit);
        } catch (ExecutionException e) {
            terminateQuietly(instance);
            record(event(SupervisionEvent.Kind.CHILD_STOP_FAILED, handle).put("error", e.getCause()));
            throw new ChildStopException(handle.name(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminateQuietly(instance);
            record(event(SupervisionEvent.Kind.CHILD_STOP_FAILED, handle).put("error", e));
            throw new ChildStopException(handle.name(), e);
        }
    }

    private void stopQuietly(ChildHandle handle) {
        try {
            doStop(handle);
        } catch (SupervisorException e) {
            logger.warn("Supervisor {}: {}", name, e.getMessage());
        }
    }

    private List<SupervisorException> stopAll(boolean remove) {
        List<SupervisorException> errors = new ArrayList<>();
        for (int i = startOrder.size() - 1; i >= 0; i--) {
            ChildHandle handle = children.get(startOrder.get(i));
            try {
                doStop(handle);
            } catch (SupervisorException e) {
                errors.add(e);
            }
        }
        if (remove) {
            children.clear();
            startOrder.clear();
        }
        return errors;
    }

    private void terminateQuietly(ChildHandle handle) {
        Child instance = handle.instance();
        handle.instance(null);
        if (instance != null) {
            terminateQuietly(instance);
        }
    }

    private void terminateQuietly(Child instance) {
        try {
            instance.terminate();
        } catch (RuntimeException e) {
            logger.warn("Supervisor {}: terminate of {} threw", name, instance, e);
        }
    }

    private ChildHandle require(ChildId childId) {
        ChildHandle handle = children.get(childId);
        if (handle == null) {
            record(SupervisionEvent.builder(name, SupervisionEvent.Kind.CHILD_NOT_FOUND)
                    .timestamp(clock.instant())
                    .child(childId));
            throw new ChildNotFoundException(childId);
        }
        return handle;
    }

    // ---------------------------------------------------------------- plumbing

    /**
     * Entry point for {@link ChildContext} reports. Queued, never run inline: the
     * reporting child may be the one about to be stopped.
     */
    private CompletableFuture<SupervisionDecision> report(ChildId childId, long generation, Throwable error) {
        if (state != SupervisorState.RUNNING) {
            return CompletableFuture.completedFuture(SupervisionDecision.ignore());
        }
        CompletableFuture<SupervisionDecision> result;
        try {
            result = CompletableFuture.supplyAsync(() -> doHandleTermination(childId, generation, error),
                    nodeExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(SupervisionDecision.ignore());
        }
        result.whenComplete((decision, failure) -> {
            if (failure != null) {
                logger.warn("Supervisor {} could not recover child {}: {}", name, childId,
                        failure.getCause() != null ? failure.getCause().getMessage() : failure.getMessage());
            }
        });
        return result;
    }

    private <T> T onNode(Supplier<T> task) {
        if (Thread.currentThread() == nodeThread) {
            return task.get();
        }
        Future<T> result;
        try {
            result = nodeExecutor.submit(task::get);
        } catch (RejectedExecutionException e) {
            throw new SupervisorStateException(name, state);
        }
        try {
            return result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new SupervisorException("Supervisor " + name + " task failed", cause, name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SupervisorException("Interrupted waiting for supervisor " + name, e, name);
        }
    }

    private void ensureRunning() {
        SupervisorState current = state;
        if (current != SupervisorState.RUNNING) {
            throw new SupervisorStateException(name, current);
        }
    }

    private static void throwCollected(List<SupervisorException> errors) {
        if (errors.isEmpty()) {
            return;
        }
        SupervisorException first = errors.get(0);
        for (int i = 1; i < errors.size(); i++) {
            first.addSuppressed(errors.get(i));
        }
        throw first;
    }

    private SupervisionEvent.Builder event(SupervisionEvent.Kind kind, ChildHandle handle) {
        return SupervisionEvent.builder(name, kind)
                .timestamp(clock.instant())
                .child(handle.id())
                .put("child", handle.name());
    }

    private void record(SupervisionEvent.Builder builder) {
        record(builder.build());
    }

    private void record(SupervisionEvent event) {
        Monitors.recordQuietly(monitor, event);
    }

    @Override
    public String toString() {
        return "SupervisorNode{" + name + ", " + strategy + ", " + state + '}';
    }
}
