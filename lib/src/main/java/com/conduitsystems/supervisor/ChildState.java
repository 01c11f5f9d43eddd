package com.conduitsystems.supervisor;

/**
 * Lifecycle state of a supervised child.
 *
 * <pre>
 * STARTING -> RUNNING -> STOPPING -> STOPPED
 * RUNNING -> FAILED -> RESTARTING -> STARTING
 * FAILED -> PERMANENTLY_FAILED   (restart budget exhausted)
 * </pre>
 */
public enum ChildState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    RESTARTING,
    FAILED,
    PERMANENTLY_FAILED;

    public boolean isRunning() {
        return this == RUNNING;
    }

    public boolean isTerminal() {
        return this == STOPPED || this == PERMANENTLY_FAILED;
    }

    public boolean isTransitional() {
        return this == STARTING || this == STOPPING || this == RESTARTING;
    }
}
