package com.conduitsystems.supervisor;

import com.conduitsystems.ConduitException;

/**
 * Base class for errors surfaced by the supervision engine.
 */
public class SupervisorException extends ConduitException {

    public SupervisorException(String message) {
        super(message);
    }

    public SupervisorException(String message, String componentId) {
        super(message, componentId);
    }

    public SupervisorException(String message, Throwable cause, String componentId) {
        super(message, cause, componentId);
    }

    /**
     * Whether the condition cannot be recovered from by retrying.
     */
    public boolean isFatal() {
        return false;
    }

    /**
     * Whether retrying the operation may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
