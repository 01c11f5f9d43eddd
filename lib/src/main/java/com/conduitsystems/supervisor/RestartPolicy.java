package com.conduitsystems.supervisor;

/**
 * Whether a child is restarted when it terminates.
 */
public enum RestartPolicy {
    /** Always restarted. */
    PERMANENT,
    /** Restarted only after an abnormal termination. */
    TRANSIENT,
    /** Never restarted. */
    TEMPORARY;

    public boolean shouldRestart(boolean abnormal) {
        switch (this) {
            case PERMANENT:
                return true;
            case TRANSIENT:
                return abnormal;
            default:
                return false;
        }
    }
}
