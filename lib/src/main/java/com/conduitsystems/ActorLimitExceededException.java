package com.conduitsystems;

/**
 * The system already runs its configured maximum number of actors.
 */
public class ActorLimitExceededException extends ConduitException {

    private final int maxActors;

    public ActorLimitExceededException(int maxActors) {
        super("Actor limit of " + maxActors + " reached");
        this.maxActors = maxActors;
    }

    public int getMaxActors() {
        return maxActors;
    }
}
