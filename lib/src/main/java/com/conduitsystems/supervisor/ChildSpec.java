package com.conduitsystems.supervisor;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable description of a supervised child: how to build it and how to treat it.
 */
public final class ChildSpec {

    public static final RestartPolicy DEFAULT_RESTART_POLICY = RestartPolicy.PERMANENT;
    public static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final Supplier<? extends Child> factory;
    private final RestartPolicy restartPolicy;
    private final ShutdownPolicy shutdownPolicy;
    private final Duration startTimeout;
    private final Duration shutdownTimeout;
    private final int maxRestarts;
    private final Duration restartWindow;
    private final BackoffDelay backoffDelay;

    private ChildSpec(Builder builder) {
        this.name = builder.name;
        this.factory = builder.factory;
        this.restartPolicy = builder.restartPolicy;
        this.shutdownPolicy = builder.shutdownPolicy;
        this.startTimeout = builder.startTimeout;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.maxRestarts = builder.maxRestarts;
        this.restartWindow = builder.restartWindow;
        this.backoffDelay = builder.backoffDelay;
    }

    public static Builder builder(String name, Supplier<? extends Child> factory) {
        return new Builder(name, factory);
    }

    public String name() {
        return name;
    }

    public Supplier<? extends Child> factory() {
        return factory;
    }

    public RestartPolicy restartPolicy() {
        return restartPolicy;
    }

    public ShutdownPolicy shutdownPolicy() {
        return shutdownPolicy;
    }

    public Duration startTimeout() {
        return startTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public int maxRestarts() {
        return maxRestarts;
    }

    public Duration restartWindow() {
        return restartWindow;
    }

    public BackoffDelay backoffDelay() {
        return backoffDelay;
    }

    @Override
    public String toString() {
        return "ChildSpec{" + name + ", " + restartPolicy + ", " + shutdownPolicy.kind()
                + ", maxRestarts=" + maxRestarts + "/" + restartWindow.toMillis() + "ms}";
    }

    public static final class Builder {
        private final String name;
        private final Supplier<? extends Child> factory;
        private RestartPolicy restartPolicy = DEFAULT_RESTART_POLICY;
        private ShutdownPolicy shutdownPolicy = ShutdownPolicy.DEFAULT;
        private Duration startTimeout = DEFAULT_START_TIMEOUT;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private int maxRestarts = RestartBackoff.DEFAULT_MAX_RESTARTS;
        private Duration restartWindow = RestartBackoff.DEFAULT_WINDOW;
        private BackoffDelay backoffDelay = RestartBackoff.DEFAULT_DELAY;

        private Builder(String name, Supplier<? extends Child> factory) {
            this.name = name;
            this.factory = factory;
        }

        public Builder restartPolicy(RestartPolicy restartPolicy) {
            this.restartPolicy = restartPolicy;
            return this;
        }

        public Builder shutdownPolicy(ShutdownPolicy shutdownPolicy) {
            this.shutdownPolicy = shutdownPolicy;
            return this;
        }

        public Builder startTimeout(Duration startTimeout) {
            this.startTimeout = startTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * At most {@code maxRestarts} restarts within {@code window}; the next failure
         * leaves the child permanently failed.
         */
        public Builder restartIntensity(int maxRestarts, Duration window) {
            this.maxRestarts = maxRestarts;
            this.restartWindow = window;
            return this;
        }

        public Builder backoffDelay(BackoffDelay backoffDelay) {
            this.backoffDelay = backoffDelay;
            return this;
        }

        /**
         * @throws InvalidConfigurationException if a value is missing or out of range
         */
        public ChildSpec build() {
            if (name == null || name.isBlank()) {
                throw new InvalidConfigurationException("Child name must not be blank");
            }
            if (factory == null) {
                throw new InvalidConfigurationException("Child '" + name + "' has no factory");
            }
            Objects.requireNonNull(restartPolicy, "restartPolicy cannot be null");
            Objects.requireNonNull(shutdownPolicy, "shutdownPolicy cannot be null");
            Objects.requireNonNull(backoffDelay, "backoffDelay cannot be null");
            requirePositive(startTimeout, "startTimeout");
            requirePositive(shutdownTimeout, "shutdownTimeout");
            requirePositive(restartWindow, "restartWindow");
            if (maxRestarts <= 0) {
                throw new InvalidConfigurationException("Child '" + name + "': maxRestarts must be positive");
            }
            return new ChildSpec(this);
        }

        private void requirePositive(Duration value, String field) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new InvalidConfigurationException("Child '" + name + "': " + field + " must be positive");
            }
        }
    }
}
