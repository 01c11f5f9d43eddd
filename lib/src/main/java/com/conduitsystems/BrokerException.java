package com.conduitsystems;

/**
 * Base class for errors raised by the registry, the message bus and mailbox delivery.
 */
public class BrokerException extends ConduitException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, String componentId) {
        super(message, componentId);
    }

    public BrokerException(String message, Throwable cause, String componentId) {
        super(message, cause, componentId);
    }

    /**
     * Whether retrying the same operation may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
