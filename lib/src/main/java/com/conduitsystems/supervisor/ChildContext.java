package com.conduitsystems.supervisor;

import java.util.concurrent.CompletableFuture;

/**
 * What a child knows about its place in the hierarchy: its own id and a way to report
 * failures upward. Reports are asynchronous, so a child may report from its own thread
 * even though handling the failure will stop that child.
 *
 * <p>Each started instance gets its own context, stamped with the instance's generation.
 * A report made through the context of an instance that has since been replaced is
 * ignored by the supervisor.
 */
public final class ChildContext {

    /**
     * Receives failure and exit reports for a supervisor.
     */
    @FunctionalInterface
    public interface Reporter {

        /**
         * @param generation the incarnation of the child making the report
         * @param error the failure, or null for a normal exit
         */
        CompletableFuture<SupervisionDecision> report(ChildId childId, long generation, Throwable error);
    }

    private final ChildId childId;
    private final long generation;
    private final String childName;
    private final String supervisorName;
    private final Reporter reporter;

    public ChildContext(ChildId childId, long generation, String childName, String supervisorName,
                        Reporter reporter) {
        this.childId = childId;
        this.generation = generation;
        this.childName = childName;
        this.supervisorName = supervisorName;
        this.reporter = reporter;
    }

    public ChildId childId() {
        return childId;
    }

    public long generation() {
        return generation;
    }

    public String childName() {
        return childName;
    }

    public String supervisorName() {
        return supervisorName;
    }

    /**
     * Reports that the child crashed.
     */
    public CompletableFuture<SupervisionDecision> reportFailure(Throwable error) {
        return reporter.report(childId, generation, error);
    }

    /**
     * Reports that the child finished normally. Only permanent children are restarted.
     */
    public CompletableFuture<SupervisionDecision> reportExit() {
        return reporter.report(childId, generation, null);
    }
}
