package com.conduitsystems.supervisor;

/**
 * A child's stop raised an error. The child has been forcibly terminated.
 */
public class ChildStopException extends SupervisorException {

    public ChildStopException(String childName, Throwable cause) {
        super("Child '" + childName + "' failed to stop: " + cause, cause, childName);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
