package com.conduitsystems.monitoring;

/**
 * Discards every event. The default monitor.
 */
public final class NoopMonitor<E extends MonitoringEvent> implements Monitor<E> {

    @SuppressWarnings("rawtypes")
    private static final NoopMonitor INSTANCE = new NoopMonitor();

    private NoopMonitor() {
    }

    @SuppressWarnings("unchecked")
    public static <E extends MonitoringEvent> NoopMonitor<E> instance() {
        return (NoopMonitor<E>) INSTANCE;
    }

    @Override
    public void record(E event) {
    }
}
