package com.conduitsystems.supervisor;

import java.time.Duration;

/**
 * Something a {@link SupervisorNode} can start, stop and restart.
 *
 * <p>Instances are built by the factory of a {@link ChildSpec}; a restart discards the old
 * instance and builds a new one. A child never references its supervisor; it reports
 * failures through the {@link ChildContext} it is attached to.
 */
public interface Child {

    /**
     * Brings the child up. Runs on a supervisor worker thread and must return within the
     * spec's start timeout.
     */
    void start() throws Exception;

    /**
     * Shuts the child down gracefully within {@code timeout}.
     */
    void stop(Duration timeout) throws Exception;

    /**
     * Forced termination, used when a graceful stop timed out or the shutdown policy is
     * immediate. Must not block.
     */
    default void terminate() {
    }

    default ChildHealth healthCheck() {
        return ChildHealth.healthy();
    }

    /**
     * Called once before {@link #start()} with the handle for reporting back.
     */
    default void attach(ChildContext context) {
    }
}
