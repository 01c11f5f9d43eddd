package com.conduitsystems.supervisor;

/**
 * Overall state of a {@link SupervisorNode}.
 */
public enum SupervisorState {
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
