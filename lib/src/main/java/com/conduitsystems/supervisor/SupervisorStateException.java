package com.conduitsystems.supervisor;

/**
 * The supervisor is shutting down or stopped and cannot take the request.
 */
public class SupervisorStateException extends SupervisorException {

    public SupervisorStateException(String supervisorName, SupervisorState state) {
        super("Supervisor " + supervisorName + " is " + state, supervisorName);
    }
}
