package com.conduitsystems.supervisor;

import java.time.Instant;
import java.util.Optional;

/**
 * Snapshot of one child, as reported by {@link SupervisorNode#healthSnapshot()}.
 *
 * @param id the child id
 * @param name the name from its spec
 * @param state lifecycle state
 * @param health result of the latest health check (healthy until one ran)
 * @param restartCount restarts since the child was first started
 * @param restartsInWindow restarts counted by the backoff window right now
 * @param lastRestart time of the latest restart, null if never restarted
 * @param startedAt time the current instance finished starting, null if not running
 */
public record ChildStatus(
        ChildId id,
        String name,
        ChildState state,
        ChildHealth health,
        int restartCount,
        int restartsInWindow,
        Instant lastRestart,
        Instant startedAt) {

    public Optional<Instant> lastRestartTime() {
        return Optional.ofNullable(lastRestart);
    }
}
