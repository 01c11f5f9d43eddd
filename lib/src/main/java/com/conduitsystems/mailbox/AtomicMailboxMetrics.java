package com.conduitsystems.mailbox;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters, the default {@link MailboxMetrics} of every mailbox.
 */
public final class AtomicMailboxMetrics implements MailboxMetrics {

    private static final long NEVER = Long.MIN_VALUE;

    private final Clock clock;
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong lastMessageMillis = new AtomicLong(NEVER);

    public AtomicMailboxMetrics() {
        this(Clock.systemUTC());
    }

    public AtomicMailboxMetrics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public void recordSent() {
        sent.incrementAndGet();
    }

    @Override
    public void recordReceived() {
        received.incrementAndGet();
        lastMessageMillis.set(clock.millis());
    }

    @Override
    public void recordDropped() {
        dropped.incrementAndGet();
    }

    @Override
    public long sentCount() {
        return sent.get();
    }

    @Override
    public long receivedCount() {
        return received.get();
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public Optional<Instant> lastMessageAt() {
        long millis = lastMessageMillis.get();
        return millis == NEVER ? Optional.empty() : Optional.of(Instant.ofEpochMilli(millis));
    }

    @Override
    public String toString() {
        return "MailboxMetrics{sent=" + sent.get() + ", received=" + received.get()
                + ", dropped=" + dropped.get() + '}';
    }
}
