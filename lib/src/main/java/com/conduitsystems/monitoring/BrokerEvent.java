package com.conduitsystems.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Something that happened on the message bus or in the router.
 */
public record BrokerEvent(Instant timestamp, Kind kind, Map<String, String> metadata) implements MonitoringEvent {

    public enum Kind {
        MESSAGE_PUBLISHED(EventSeverity.DEBUG),
        MESSAGE_ROUTED(EventSeverity.DEBUG),
        SUBSCRIBER_ADDED(EventSeverity.INFO),
        SUBSCRIBER_REMOVED(EventSeverity.INFO),
        REQUEST_TIMED_OUT(EventSeverity.WARNING),
        ROUTING_FAILED(EventSeverity.ERROR),
        ROUTE_CONFIGURATION_ERROR(EventSeverity.ERROR),
        DEAD_LETTER(EventSeverity.WARNING);

        private final EventSeverity severity;

        Kind(EventSeverity severity) {
            this.severity = severity;
        }

        public EventSeverity severity() {
            return severity;
        }
    }

    public BrokerEvent {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        metadata = Map.copyOf(metadata);
    }

    public static BrokerEvent of(Kind kind) {
        return new BrokerEvent(Instant.now(), kind, Map.of());
    }

    /**
     * Creates an event from alternating key/value pairs; null values are skipped.
     */
    public static BrokerEvent of(Kind kind, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                metadata.put(String.valueOf(keyValues[i]), String.valueOf(keyValues[i + 1]));
            }
        }
        return new BrokerEvent(Instant.now(), kind, metadata);
    }

    @Override
    public EventSeverity severity() {
        return kind.severity();
    }

    @Override
    public String eventType() {
        return kind.name();
    }
}
