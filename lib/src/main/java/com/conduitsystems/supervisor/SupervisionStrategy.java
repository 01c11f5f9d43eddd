package com.conduitsystems.supervisor;

import java.util.List;

/**
 * Decides which children restart when one fails. Each variant is a pure function of the
 * failed id and the children in start order.
 */
public enum SupervisionStrategy {

    /** Only the failed child restarts. */
    ONE_FOR_ONE {
        @Override
        public List<ChildId> restartTargets(ChildId failed, List<ChildId> startOrder) {
            return startOrder.contains(failed) ? List.of(failed) : List.of();
        }

        @Override
        public SupervisionDecision.Directive directive() {
            return SupervisionDecision.Directive.RESTART_CHILD;
        }
    },

    /** Every child restarts, in start order. */
    ONE_FOR_ALL {
        @Override
        public List<ChildId> restartTargets(ChildId failed, List<ChildId> startOrder) {
            return startOrder.contains(failed) ? List.copyOf(startOrder) : List.of();
        }

        @Override
        public SupervisionDecision.Directive directive() {
            return SupervisionDecision.Directive.RESTART_ALL;
        }
    },

    /** The failed child and every child started after it restart. */
    REST_FOR_ONE {
        @Override
        public List<ChildId> restartTargets(ChildId failed, List<ChildId> startOrder) {
            int index = startOrder.indexOf(failed);
            return index < 0 ? List.of() : List.copyOf(startOrder.subList(index, startOrder.size()));
        }

        @Override
        public SupervisionDecision.Directive directive() {
            return SupervisionDecision.Directive.RESTART_SUBSET;
        }
    };

    /**
     * @param failed the child that failed
     * @param startOrder all children of the supervisor, in start order
     * @return the children to restart, in start order; empty if {@code failed} is unknown
     */
    public abstract List<ChildId> restartTargets(ChildId failed, List<ChildId> startOrder);

    public abstract SupervisionDecision.Directive directive();
}
