package com.conduitsystems.monitoring;

import java.time.Instant;
import java.util.Map;

/**
 * An event recorded by a {@link Monitor}.
 */
public interface MonitoringEvent {

    Instant timestamp();

    EventSeverity severity();

    /**
     * Short machine-friendly name of the event kind.
     */
    String eventType();

    Map<String, String> metadata();
}
