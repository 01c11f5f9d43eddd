package com.conduitsystems.monitoring;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of an {@link InMemoryMonitor}.
 *
 * @param timestamp when the snapshot was taken
 * @param totalEvents events accepted since creation or the last reset
 * @param countsBySeverity accepted events per severity
 * @param recentEvents retained history, oldest first
 */
public record MonitoringSnapshot<E extends MonitoringEvent>(
        Instant timestamp,
        long totalEvents,
        Map<EventSeverity, Long> countsBySeverity,
        List<E> recentEvents) {

    public long count(EventSeverity severity) {
        return countsBySeverity.getOrDefault(severity, 0L);
    }
}
