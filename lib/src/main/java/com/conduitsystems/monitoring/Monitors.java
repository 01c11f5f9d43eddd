package com.conduitsystems.monitoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for working with {@link Monitor}s.
 */
public final class Monitors {

    private static final Logger logger = LoggerFactory.getLogger(Monitors.class);

    private Monitors() {
    }

    /**
     * Records the event, logging and discarding anything the monitor throws.
     */
    public static <E extends MonitoringEvent> void recordQuietly(Monitor<E> monitor, E event) {
        try {
            monitor.record(event);
        } catch (RuntimeException e) {
            logger.warn("Monitor {} failed to record {}", monitor.getClass().getSimpleName(), event.eventType(), e);
        }
    }

    /**
     * Returns a monitor that forwards every event to all of the given monitors.
     */
    @SafeVarargs
    public static <E extends MonitoringEvent> Monitor<E> fanOut(Monitor<E>... monitors) {
        Monitor<E>[] targets = monitors.clone();
        return event -> {
            for (Monitor<E> target : targets) {
                recordQuietly(target, event);
            }
        };
    }
}
