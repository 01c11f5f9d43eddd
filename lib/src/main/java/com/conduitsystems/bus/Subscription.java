package com.conduitsystems.bus;

import com.conduitsystems.mailbox.Mailbox;
import com.conduitsystems.mailbox.MpscMailbox;
import com.conduitsystems.message.MessageEnvelope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * One independent consumer of everything published on a bus. Backed by an unbounded
 * MPSC stream: any thread may publish, one thread reads.
 */
public final class Subscription implements AutoCloseable {

    private final UUID id = UUID.randomUUID();
    private final Mailbox<MessageEnvelope<?>> stream = new MpscMailbox<>();

    Subscription() {
    }

    boolean deliver(MessageEnvelope<?> envelope) {
        return stream.offer(envelope);
    }

    public UUID id() {
        return id;
    }

    /**
     * Waits up to {@code timeout} for the next envelope.
     *
     * @return the next envelope, or null if none arrived in time
     */
    public MessageEnvelope<?> poll(Duration timeout) throws InterruptedException {
        return stream.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public MessageEnvelope<?> poll() {
        return stream.poll();
    }

    public MessageEnvelope<?> take() throws InterruptedException {
        return stream.take();
    }

    /**
     * Removes and returns everything still queued.
     */
    public List<MessageEnvelope<?>> drain() {
        List<MessageEnvelope<?>> remaining = new ArrayList<>();
        stream.drainTo(remaining, Integer.MAX_VALUE);
        return remaining;
    }

    public int pending() {
        return stream.size();
    }

    public boolean isClosed() {
        return stream.isClosed();
    }

    /**
     * Stops receiving. Already queued envelopes stay readable; the bus drops the
     * subscription on its next publish.
     */
    @Override
    public void close() {
        stream.close();
    }

    @Override
    public String toString() {
        return "Subscription{" + id + (isClosed() ? ", closed" : "") + '}';
    }
}
