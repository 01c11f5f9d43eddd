package com.conduitsystems.supervisor;

/**
 * The supervisor has no child with the given id.
 */
public class ChildNotFoundException extends SupervisorException {

    public ChildNotFoundException(ChildId childId) {
        super("Child not found: " + childId, String.valueOf(childId));
    }
}
