package com.conduitsystems.monitoring;

/**
 * Sink for monitoring events. Recording is fire-and-forget: implementations must not
 * block the caller. Runtime components record through {@link Monitors#recordQuietly}
 * so that a faulty sink can never fail the operation that produced the event.
 *
 * @param <E> the event type
 */
@FunctionalInterface
public interface Monitor<E extends MonitoringEvent> {

    void record(E event);
}
