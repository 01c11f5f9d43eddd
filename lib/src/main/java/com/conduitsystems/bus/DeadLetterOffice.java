package com.conduitsystems.bus;

import com.conduitsystems.monitoring.BrokerEvent;
import com.conduitsystems.monitoring.Monitor;
import com.conduitsystems.monitoring.Monitors;
import com.conduitsystems.monitoring.NoopMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded store of undeliverable envelopes. When full, the oldest dead letter is evicted.
 */
public class DeadLetterOffice {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterOffice.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Monitor<BrokerEvent> monitor;
    private final Deque<DeadLetter> letters = new ArrayDeque<>();
    private final AtomicLong total = new AtomicLong();

    public DeadLetterOffice() {
        this(DEFAULT_CAPACITY, NoopMonitor.instance());
    }

    public DeadLetterOffice(int capacity, Monitor<BrokerEvent> monitor) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.monitor = monitor;
    }

    public void post(DeadLetter letter) {
        logger.warn("Dead letter ({}): {} - {}", letter.reason(), letter.envelope(), letter.detail());
        synchronized (letters) {
            if (letters.size() >= capacity) {
                letters.pollFirst();
            }
            letters.addLast(letter);
        }
        total.incrementAndGet();
        Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.DEAD_LETTER,
                "reason", letter.reason(),
                "recipient", letter.envelope().recipient().orElse(null),
                "detail", letter.detail()));
    }

    /**
     * Retained dead letters, oldest first.
     */
    public List<DeadLetter> letters() {
        synchronized (letters) {
            return List.copyOf(letters);
        }
    }

    /**
     * Removes and returns all retained dead letters.
     */
    public List<DeadLetter> drain() {
        synchronized (letters) {
            List<DeadLetter> drained = new ArrayList<>(letters);
            letters.clear();
            return drained;
        }
    }

    public int size() {
        synchronized (letters) {
            return letters.size();
        }
    }

    /**
     * Dead letters posted since creation, including evicted ones.
     */
    public long totalCount() {
        return total.get();
    }

    public int capacity() {
        return capacity;
    }
}
