package com.conduitsystems.monitoring;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMonitorTest {

    private static SupervisionEvent event(SupervisionEvent.Kind kind) {
        return SupervisionEvent.builder("sup", kind).child("c1").build();
    }

    @Test
    void defaultFilterDropsEventsBelowInfo() {
        InMemoryMonitor<BrokerEvent> monitor = new InMemoryMonitor<>();

        monitor.record(BrokerEvent.of(BrokerEvent.Kind.MESSAGE_PUBLISHED));
        monitor.record(BrokerEvent.of(BrokerEvent.Kind.SUBSCRIBER_ADDED));

        assertEquals(1, monitor.totalEvents());
        assertEquals(BrokerEvent.Kind.SUBSCRIBER_ADDED, monitor.history().get(0).kind());
    }

    @Test
    void traceFilterKeepsEverything() {
        InMemoryMonitor<BrokerEvent> monitor = new InMemoryMonitor<>(
                new MonitoringConfig().setSeverityFilter(EventSeverity.TRACE));

        monitor.record(BrokerEvent.of(BrokerEvent.Kind.MESSAGE_PUBLISHED));
        monitor.record(BrokerEvent.of(BrokerEvent.Kind.MESSAGE_ROUTED));

        assertEquals(2, monitor.totalEvents());
        assertEquals(2, monitor.snapshot().count(EventSeverity.DEBUG));
    }

    @Test
    void disabledMonitorRecordsNothing() {
        InMemoryMonitor<SupervisionEvent> monitor = new InMemoryMonitor<>(new MonitoringConfig().setEnabled(false));

        monitor.record(event(SupervisionEvent.Kind.CHILD_FAILED));

        assertEquals(0, monitor.totalEvents());
        assertTrue(monitor.history().isEmpty());
    }

    @Test
    void historyIsBoundedAndKeepsNewest() {
        InMemoryMonitor<SupervisionEvent> monitor = new InMemoryMonitor<>(new MonitoringConfig().setMaxHistorySize(2));

        monitor.record(event(SupervisionEvent.Kind.CHILD_STARTED));
        monitor.record(event(SupervisionEvent.Kind.CHILD_FAILED));
        monitor.record(event(SupervisionEvent.Kind.CHILD_RESTARTED));

        List<SupervisionEvent> history = monitor.history();
        assertEquals(2, history.size());
        assertEquals(SupervisionEvent.Kind.CHILD_FAILED, history.get(0).kind());
        assertEquals(SupervisionEvent.Kind.CHILD_RESTARTED, history.get(1).kind());
        // counters still see every accepted event
        assertEquals(3, monitor.totalEvents());
    }

    @Test
    void zeroHistoryOnlyCounts() {
        InMemoryMonitor<SupervisionEvent> monitor = new InMemoryMonitor<>(new MonitoringConfig().setMaxHistorySize(0));

        monitor.record(event(SupervisionEvent.Kind.CHILD_STARTED));

        assertEquals(1, monitor.totalEvents());
        assertTrue(monitor.history().isEmpty());
    }

    @Test
    void snapshotCountsBySeverity() {
        InMemoryMonitor<SupervisionEvent> monitor = new InMemoryMonitor<>();
        monitor.record(event(SupervisionEvent.Kind.CHILD_STARTED));
        monitor.record(event(SupervisionEvent.Kind.CHILD_STOPPED));
        monitor.record(event(SupervisionEvent.Kind.CHILD_FAILED));
        monitor.record(event(SupervisionEvent.Kind.RESTART_LIMIT_EXCEEDED));

        MonitoringSnapshot<SupervisionEvent> snapshot = monitor.snapshot();

        assertEquals(4, snapshot.totalEvents());
        assertEquals(2, snapshot.count(EventSeverity.INFO));
        assertEquals(1, snapshot.count(EventSeverity.ERROR));
        assertEquals(1, snapshot.count(EventSeverity.CRITICAL));
        assertEquals(0, snapshot.count(EventSeverity.WARNING));
        assertEquals(4, snapshot.recentEvents().size());
    }

    @Test
    void historyFilterAndReset() {
        InMemoryMonitor<SupervisionEvent> monitor = new InMemoryMonitor<>();
        monitor.record(event(SupervisionEvent.Kind.CHILD_STARTED));
        monitor.record(event(SupervisionEvent.Kind.CHILD_FAILED));

        assertEquals(1, monitor.history(e -> e.severity().isAtLeast(EventSeverity.ERROR)).size());

        monitor.reset();

        assertEquals(0, monitor.totalEvents());
        assertTrue(monitor.history().isEmpty());
        assertEquals(0, monitor.snapshot().count(EventSeverity.ERROR));
    }

    @Test
    void concurrentRecordingLosesNothing() throws InterruptedException {
        InMemoryMonitor<SupervisionEvent> monitor = new InMemoryMonitor<>(
                new MonitoringConfig().setMaxHistorySize(10_000));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 500; i++) {
                    monitor.record(event(SupervisionEvent.Kind.CHILD_STARTED));
                }
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(2000, monitor.totalEvents());
        assertEquals(2000, monitor.history().size());
    }

    @Test
    void negativeHistorySizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MonitoringConfig().setMaxHistorySize(-1));
    }
}
