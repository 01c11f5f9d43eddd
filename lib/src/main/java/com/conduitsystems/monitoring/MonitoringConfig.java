package com.conduitsystems.monitoring;

/**
 * Configuration of an {@link InMemoryMonitor}.
 */
public class MonitoringConfig {

    public static final boolean DEFAULT_ENABLED = true;
    public static final int DEFAULT_MAX_HISTORY_SIZE = 1000;
    public static final EventSeverity DEFAULT_SEVERITY_FILTER = EventSeverity.INFO;

    private boolean enabled = DEFAULT_ENABLED;
    private int maxHistorySize = DEFAULT_MAX_HISTORY_SIZE;
    private EventSeverity severityFilter = DEFAULT_SEVERITY_FILTER;

    public boolean isEnabled() {
        return enabled;
    }

    public MonitoringConfig setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public MonitoringConfig setMaxHistorySize(int maxHistorySize) {
        if (maxHistorySize < 0) {
            throw new IllegalArgumentException("maxHistorySize must not be negative");
        }
        this.maxHistorySize = maxHistorySize;
        return this;
    }

    public EventSeverity getSeverityFilter() {
        return severityFilter;
    }

    /**
     * Events below this severity are ignored entirely.
     */
    public MonitoringConfig setSeverityFilter(EventSeverity severityFilter) {
        this.severityFilter = severityFilter;
        return this;
    }
}
