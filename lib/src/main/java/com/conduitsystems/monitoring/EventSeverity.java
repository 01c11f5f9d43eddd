package com.conduitsystems.monitoring;

/**
 * Severity of a monitoring event, ordered from least to most severe.
 */
public enum EventSeverity {
    TRACE,
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(EventSeverity other) {
        return compareTo(other) >= 0;
    }
}
