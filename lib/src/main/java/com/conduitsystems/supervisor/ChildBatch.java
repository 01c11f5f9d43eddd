package com.conduitsystems.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Starts several children of one supervisor with shared defaults. Settings made on the
 * batch apply to every child; a per-child customizer runs afterwards and can override any
 * of them. Settings made on neither keep the {@link ChildSpec} defaults.
 *
 * <pre>{@code
 * List<ChildId> ids = node.childBatch()
 *         .restartPolicy(RestartPolicy.TRANSIENT)
 *         .shutdownTimeout(Duration.ofSeconds(2))
 *         .child("reader", Reader::new)
 *         .child("writer", Writer::new, spec -> spec.restartPolicy(RestartPolicy.PERMANENT))
 *         .startAll();
 * }</pre>
 *
 * <p>Every spec is validated before the first child starts. If a child then fails to
 * start, the ones this batch already started are stopped again, newest first, and the
 * start failure is thrown.
 */
public final class ChildBatch {

    private static final Logger logger = LoggerFactory.getLogger(ChildBatch.class);

    private record Entry(String name, Supplier<? extends Child> factory, Consumer<ChildSpec.Builder> customizer) {
    }

    private final SupervisorNode node;
    private final List<Entry> entries = new ArrayList<>();
    private RestartPolicy restartPolicy;
    private ShutdownPolicy shutdownPolicy;
    private Duration startTimeout;
    private Duration shutdownTimeout;
    private Integer maxRestarts;
    private Duration restartWindow;
    private BackoffDelay backoffDelay;

    ChildBatch(SupervisorNode node) {
        this.node = node;
    }

    public ChildBatch restartPolicy(RestartPolicy restartPolicy) {
        this.restartPolicy = Objects.requireNonNull(restartPolicy, "restartPolicy cannot be null");
        return this;
    }

    public ChildBatch shutdownPolicy(ShutdownPolicy shutdownPolicy) {
        this.shutdownPolicy = Objects.requireNonNull(shutdownPolicy, "shutdownPolicy cannot be null");
        return this;
    }

    public ChildBatch startTimeout(Duration startTimeout) {
        this.startTimeout = Objects.requireNonNull(startTimeout, "startTimeout cannot be null");
        return this;
    }

    public ChildBatch shutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout cannot be null");
        return this;
    }

    public ChildBatch restartIntensity(int maxRestarts, Duration window) {
        this.maxRestarts = maxRestarts;
        this.restartWindow = Objects.requireNonNull(window, "window cannot be null");
        return this;
    }

    public ChildBatch backoffDelay(BackoffDelay backoffDelay) {
        this.backoffDelay = Objects.requireNonNull(backoffDelay, "backoffDelay cannot be null");
        return this;
    }

    /**
     * Adds a child that takes the batch defaults as they are.
     */
    public ChildBatch child(String name, Supplier<? extends Child> factory) {
        return child(name, factory, spec -> {
        });
    }

    /**
     * Adds a child; {@code customizer} sees a builder with the batch defaults already
     * applied.
     */
    public ChildBatch child(String name, Supplier<? extends Child> factory, Consumer<ChildSpec.Builder> customizer) {
        entries.add(new Entry(name, factory, Objects.requireNonNull(customizer, "customizer cannot be null")));
        return this;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Builds the spec of every child, in the order they were added.
     *
     * @throws InvalidConfigurationException if any spec is invalid, or two children share a name
     */
    public List<ChildSpec> specs() {
        List<ChildSpec> specs = new ArrayList<>(entries.size());
        Set<String> names = new HashSet<>();
        for (Entry entry : entries) {
            if (!names.add(entry.name())) {
                throw new InvalidConfigurationException("Batch contains child '" + entry.name() + "' twice");
            }
            ChildSpec.Builder builder = ChildSpec.builder(entry.name(), entry.factory());
            applyDefaults(builder);
            entry.customizer().accept(builder);
            specs.add(builder.build());
        }
        return specs;
    }

    /**
     * Starts every child in the order they were added.
     *
     * @return the ids, in the same order
     * @throws InvalidConfigurationException if any spec is invalid; nothing is started
     * @throws SupervisorException if a child could not be started; the children started
     *         before it are stopped again
     */
    public List<ChildId> startAll() {
        List<ChildSpec> specs = specs();
        List<ChildId> started = new ArrayList<>(specs.size());
        for (ChildSpec spec : specs) {
            try {
                started.add(node.startChild(spec));
            } catch (RuntimeException e) {
                logger.warn("Batch start on supervisor {} failed at child {}, stopping {} started children",
                        node.name(), spec.name(), started.size());
                rollBack(started, e);
                throw e;
            }
        }
        return started;
    }

    /**
     * As {@link #startAll()}, keyed by child name in the order they were added.
     */
    public Map<String, ChildId> startAllByName() {
        List<ChildId> ids = startAll();
        Map<String, ChildId> byName = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            byName.put(entries.get(i).name(), ids.get(i));
        }
        return byName;
    }

    private void applyDefaults(ChildSpec.Builder builder) {
        if (restartPolicy != null) {
            builder.restartPolicy(restartPolicy);
        }
        if (shutdownPolicy != null) {
            builder.shutdownPolicy(shutdownPolicy);
        }
        if (startTimeout != null) {
            builder.startTimeout(startTimeout);
        }
        if (shutdownTimeout != null) {
            builder.shutdownTimeout(shutdownTimeout);
        }
        if (maxRestarts != null) {
            builder.restartIntensity(maxRestarts, restartWindow);
        }
        if (backoffDelay != null) {
            builder.backoffDelay(backoffDelay);
        }
    }

    private void rollBack(List<ChildId> started, RuntimeException failure) {
        for (int i = started.size() - 1; i >= 0; i--) {
            try {
                node.stopChild(started.get(i));
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
