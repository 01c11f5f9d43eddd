package com.conduitsystems.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Something that happened to a supervised child.
 *
 * @param timestamp when it happened
 * @param supervisorId name of the supervisor that recorded it
 * @param childId id of the child concerned, null for node-wide events
 * @param kind what happened
 * @param metadata free-form details (child name, error, restart count, strategy...)
 */
public record SupervisionEvent(
        Instant timestamp,
        String supervisorId,
        String childId,
        Kind kind,
        Map<String, String> metadata) implements MonitoringEvent {

    public enum Kind {
        CHILD_STARTED(EventSeverity.INFO),
        CHILD_STOPPED(EventSeverity.INFO),
        CHILD_STOP_FAILED(EventSeverity.ERROR),
        SHUTDOWN_TIMEOUT(EventSeverity.WARNING),
        CHILD_NOT_FOUND(EventSeverity.WARNING),
        CHILD_FAILED(EventSeverity.ERROR),
        CHILD_RESTARTED(EventSeverity.WARNING),
        RESTART_LIMIT_EXCEEDED(EventSeverity.CRITICAL),
        STRATEGY_APPLIED(EventSeverity.INFO),
        HEALTH_DEGRADED(EventSeverity.WARNING),
        HEALTH_CHECK_FAILED(EventSeverity.WARNING);

        private final EventSeverity severity;

        Kind(EventSeverity severity) {
            this.severity = severity;
        }

        public EventSeverity severity() {
            return severity;
        }
    }

    public SupervisionEvent {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(supervisorId, "supervisorId cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        metadata = Map.copyOf(metadata);
    }

    public static Builder builder(String supervisorId, Kind kind) {
        return new Builder(supervisorId, kind);
    }

    public Optional<String> child() {
        return Optional.ofNullable(childId);
    }

    @Override
    public EventSeverity severity() {
        return kind.severity();
    }

    @Override
    public String eventType() {
        return kind.name();
    }

    public static final class Builder {
        private final String supervisorId;
        private final Kind kind;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private String childId;
        private Instant timestamp;

        private Builder(String supervisorId, Kind kind) {
            this.supervisorId = supervisorId;
            this.kind = kind;
        }

        public Builder child(Object childId) {
            this.childId = childId == null ? null : childId.toString();
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder put(String key, Object value) {
            if (value != null) {
                metadata.put(key, String.valueOf(value));
            }
            return this;
        }

        public SupervisionEvent build() {
            return new SupervisionEvent(timestamp != null ? timestamp : Instant.now(), supervisorId, childId,
                    kind, metadata);
        }
    }
}
