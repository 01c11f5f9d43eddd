package com.conduitsystems.supervisor;

/**
 * A child spec or supervisor configuration is unusable.
 */
public class InvalidConfigurationException extends SupervisorException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
