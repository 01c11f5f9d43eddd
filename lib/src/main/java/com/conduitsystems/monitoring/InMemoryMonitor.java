package com.conduitsystems.monitoring;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;

/**
 * Keeps per-severity counters and a bounded history of recent events.
 *
 * @param <E> the event type
 */
public class InMemoryMonitor<E extends MonitoringEvent> implements Monitor<E> {

    private final MonitoringConfig config;
    private final Map<EventSeverity, LongAdder> counters = new EnumMap<>(EventSeverity.class);
    private final LongAdder total = new LongAdder();
    private final Deque<E> history = new ArrayDeque<>();

    public InMemoryMonitor() {
        this(new MonitoringConfig());
    }

    public InMemoryMonitor(MonitoringConfig config) {
        this.config = config;
        for (EventSeverity severity : EventSeverity.values()) {
            counters.put(severity, new LongAdder());
        }
    }

    @Override
    public void record(E event) {
        if (!config.isEnabled() || !event.severity().isAtLeast(config.getSeverityFilter())) {
            return;
        }
        total.increment();
        counters.get(event.severity()).increment();

        int max = config.getMaxHistorySize();
        if (max == 0) {
            return;
        }
        synchronized (history) {
            if (history.size() >= max) {
                history.pollFirst();
            }
            history.addLast(event);
        }
    }

    public MonitoringSnapshot<E> snapshot() {
        Map<EventSeverity, Long> counts = new EnumMap<>(EventSeverity.class);
        counters.forEach((severity, adder) -> counts.put(severity, adder.sum()));
        return new MonitoringSnapshot<>(Instant.now(), total.sum(), Collections.unmodifiableMap(counts), history());
    }

    /**
     * Retained events, oldest first.
     */
    public List<E> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public List<E> history(Predicate<? super E> filter) {
        List<E> result = new ArrayList<>();
        for (E event : history()) {
            if (filter.test(event)) {
                result.add(event);
            }
        }
        return result;
    }

    public long totalEvents() {
        return total.sum();
    }

    public void reset() {
        synchronized (history) {
            history.clear();
        }
        total.reset();
        counters.values().forEach(LongAdder::reset);
    }
}
