package com.conduitsystems.supervisor;

/**
 * An operation would break the supervisor hierarchy: unknown parent, or escalation
 * past a root.
 */
public class TreeIntegrityException extends SupervisorException {

    public TreeIntegrityException(String message) {
        super(message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
