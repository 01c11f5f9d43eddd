package com.conduitsystems.supervisor;

import java.util.List;

/**
 * What a supervisor did about a failure.
 *
 * @param directive the kind of action
 * @param affected children that were restarted or stopped, in start order
 */
public record SupervisionDecision(Directive directive, List<ChildId> affected) {

    public enum Directive {
        RESTART_CHILD,
        RESTART_ALL,
        RESTART_SUBSET,
        STOP_CHILD,
        /** The report was ignored, e.g. because the supervisor is shutting down. */
        IGNORE
    }

    public SupervisionDecision {
        affected = List.copyOf(affected);
    }

    public static SupervisionDecision stop(ChildId childId) {
        return new SupervisionDecision(Directive.STOP_CHILD, List.of(childId));
    }

    public static SupervisionDecision ignore() {
        return new SupervisionDecision(Directive.IGNORE, List.of());
    }
}
