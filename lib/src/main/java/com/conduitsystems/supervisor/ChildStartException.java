package com.conduitsystems.supervisor;

/**
 * A child could not be built by its factory or did not start within its start timeout.
 */
public class ChildStartException extends SupervisorException {

    public ChildStartException(String childName, String reason, Throwable cause) {
        super("Child '" + childName + "' failed to start: " + reason, cause, childName);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
