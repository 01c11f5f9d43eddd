package com.conduitsystems;

/**
 * Base class for every error raised by the runtime.
 * Carries the id of the component (address, child or supervisor) the error concerns.
 */
public class ConduitException extends RuntimeException {

    /** The id of the component where the error occurred. */
    private final String componentId;

    public ConduitException(String message) {
        this(message, null, null);
    }

    public ConduitException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ConduitException(String message, String componentId) {
        this(message, null, componentId);
    }

    /**
     * @param message the detail message
     * @param cause the cause, may be null
     * @param componentId the address, child or supervisor concerned, may be null
     */
    public ConduitException(String message, Throwable cause, String componentId) {
        super(message, cause);
        this.componentId = componentId;
    }

    /**
     * Returns the id of the component where the error occurred.
     *
     * @return the component id, or null if not specified
     */
    public String getComponentId() {
        return componentId;
    }
}
