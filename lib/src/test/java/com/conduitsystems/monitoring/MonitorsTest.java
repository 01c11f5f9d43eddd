package com.conduitsystems.monitoring;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MonitorsTest {

    @Test
    void recordQuietlySwallowsMonitorFailures() {
        Monitor<BrokerEvent> broken = event -> {
            throw new IllegalStateException("sink down");
        };

        assertDoesNotThrow(() -> Monitors.recordQuietly(broken, BrokerEvent.of(BrokerEvent.Kind.DEAD_LETTER)));
    }

    @Test
    void fanOutReachesEveryMonitorEvenIfOneFails() {
        InMemoryMonitor<BrokerEvent> first = new InMemoryMonitor<>();
        InMemoryMonitor<BrokerEvent> second = new InMemoryMonitor<>();
        Monitor<BrokerEvent> broken = event -> {
            throw new IllegalStateException("sink down");
        };

        Monitor<BrokerEvent> fanOut = Monitors.fanOut(first, broken, second);
        fanOut.record(BrokerEvent.of(BrokerEvent.Kind.SUBSCRIBER_ADDED));

        assertEquals(1, first.totalEvents());
        assertEquals(1, second.totalEvents());
    }

    @Test
    void noopMonitorIgnoresEvents() {
        Monitor<SupervisionEvent> noop = NoopMonitor.instance();

        assertDoesNotThrow(() -> noop.record(
                SupervisionEvent.builder("sup", SupervisionEvent.Kind.CHILD_FAILED).build()));
        assertSame(NoopMonitor.instance(), noop);
    }

    @Test
    void loggingMonitorMapsSeverityToLevel() {
        Logger logger = mock(Logger.class);
        LoggingMonitor<BrokerEvent> monitor = new LoggingMonitor<>(logger);

        monitor.record(BrokerEvent.of(BrokerEvent.Kind.MESSAGE_ROUTED));
        monitor.record(BrokerEvent.of(BrokerEvent.Kind.SUBSCRIBER_ADDED));
        monitor.record(BrokerEvent.of(BrokerEvent.Kind.REQUEST_TIMED_OUT));

        verify(logger).debug(eq("{} {}"), eq("MESSAGE_ROUTED"), any(Object.class));
        verify(logger).info(eq("{} {}"), eq("SUBSCRIBER_ADDED"), any(Object.class));
        verify(logger).warn(eq("{} {}"), eq("REQUEST_TIMED_OUT"), any(Object.class));
    }

    @Test
    void loggingMonitorLogsErrorsWithSeverity() {
        Logger logger = mock(Logger.class);
        LoggingMonitor<SupervisionEvent> monitor = new LoggingMonitor<>(logger);

        monitor.record(SupervisionEvent.builder("sup", SupervisionEvent.Kind.RESTART_LIMIT_EXCEEDED).build());

        verify(logger).error(eq("{} [{}] {}"), eq("RESTART_LIMIT_EXCEEDED"), eq(EventSeverity.CRITICAL),
                any(Object.class));
    }

    @Test
    void brokerEventSkipsNullValues() {
        BrokerEvent event = BrokerEvent.of(BrokerEvent.Kind.ROUTING_FAILED, "reason", "EXPIRED", "recipient", null);

        assertEquals(Map.of("reason", "EXPIRED"), event.metadata());
        assertEquals(EventSeverity.ERROR, event.severity());
        assertEquals("ROUTING_FAILED", event.eventType());
    }

    @Test
    void brokerEventRejectsOddKeyValues() {
        assertThrows(IllegalArgumentException.class,
                () -> BrokerEvent.of(BrokerEvent.Kind.DEAD_LETTER, "reason"));
    }

    @Test
    void supervisionEventBuilderFillsDefaults() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        SupervisionEvent event = SupervisionEvent.builder("root", SupervisionEvent.Kind.CHILD_FAILED)
                .child("c-1")
                .timestamp(at)
                .put("error", "boom")
                .put("ignored", null)
                .build();

        assertEquals(at, event.timestamp());
        assertEquals("c-1", event.child().orElseThrow());
        assertEquals(Map.of("error", "boom"), event.metadata());
        assertEquals(EventSeverity.ERROR, event.severity());

        SupervisionEvent nodeWide = SupervisionEvent.builder("root", SupervisionEvent.Kind.STRATEGY_APPLIED).build();
        assertTrue(nodeWide.child().isEmpty());
        assertNotNull(nodeWide.timestamp());
    }
}
