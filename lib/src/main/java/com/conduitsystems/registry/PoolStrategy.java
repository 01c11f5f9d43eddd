package com.conduitsystems.registry;

/**
 * How {@link ActorRegistry#poolMember} picks among the members of a pool.
 */
public enum PoolStrategy {
    /**
     * Cycle through members using a wrapping per-pool counter.
     */
    ROUND_ROBIN,

    /**
     * Pick a uniformly random member.
     */
    RANDOM
}
