package com.conduitsystems.supervisor;

import java.time.Instant;

/**
 * The supervisor's record of one child: its spec, backoff state and live instance.
 * Only the owning {@link SupervisorNode} reads or writes it, always from its own thread.
 */
final class ChildHandle {

    private final ChildId id;
    private final ChildSpec spec;
    private final RestartBackoff backoff;
    private ChildState state = ChildState.STARTING;
    private Child instance;
    private long generation;
    private int restartCount;
    private Instant lastRestart;
    private Instant startedAt;
    private ChildHealth lastHealth = ChildHealth.healthy();

    ChildHandle(ChildId id, ChildSpec spec, RestartBackoff backoff) {
        this.id = id;
        this.spec = spec;
        this.backoff = backoff;
    }

    ChildId id() {
        return id;
    }

    ChildSpec spec() {
        return spec;
    }

    String name() {
        return spec.name();
    }

    RestartBackoff backoff() {
        return backoff;
    }

    ChildState state() {
        return state;
    }

    void state(ChildState state) {
        this.state = state;
    }

    Child instance() {
        return instance;
    }

    void instance(Child instance) {
        this.instance = instance;
    }

    /**
     * Incarnation number of the current instance, starting at 1.
     */
    long generation() {
        return generation;
    }

    long nextGeneration() {
        return ++generation;
    }

    int restartCount() {
        return restartCount;
    }

    void recordRestart(Instant at) {
        restartCount++;
        lastRestart = at;
    }

    Instant lastRestart() {
        return lastRestart;
    }

    Instant startedAt() {
        return startedAt;
    }

    void startedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    ChildHealth lastHealth() {
        return lastHealth;
    }

    void lastHealth(ChildHealth lastHealth) {
        this.lastHealth = lastHealth;
    }

    ChildStatus status() {
        return new ChildStatus(id, spec.name(), state, lastHealth, restartCount, backoff.restartCount(),
                lastRestart, startedAt);
    }
}
