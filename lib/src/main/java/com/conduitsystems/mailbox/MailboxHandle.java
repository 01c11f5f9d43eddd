package com.conduitsystems.mailbox;

import com.conduitsystems.address.Address;
import com.conduitsystems.backpressure.BackpressureStrategy;
import com.conduitsystems.message.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;

/**
 * An actor mailbox as stored in the registry. Senders go through {@link #send}, which
 * applies the backpressure strategy when the queue is full; the owning actor reads with
 * {@link #poll} and {@link #drainTo}.
 *
 * <p>Messages the consumer took but could not process (because its incarnation crashed
 * or stopped mid-batch) are handed back with {@link #pushBack} and are read again before
 * anything still queued, so delivery order survives restarts.
 */
public final class MailboxHandle {

    private static final Logger logger = LoggerFactory.getLogger(MailboxHandle.class);

    private final Address address;
    private final Mailbox<MessageEnvelope<?>> mailbox;
    private final BackpressureStrategy strategy;
    private final Duration sendTimeout;
    private final MailboxMetrics metrics;
    private final Deque<MessageEnvelope<?>> pushedBack = new ConcurrentLinkedDeque<>();

    public MailboxHandle(Address address, Mailbox<MessageEnvelope<?>> mailbox,
                         BackpressureStrategy strategy, Duration sendTimeout) {
        this(address, mailbox, strategy, sendTimeout, new AtomicMailboxMetrics());
    }

    public MailboxHandle(Address address, Mailbox<MessageEnvelope<?>> mailbox,
                         BackpressureStrategy strategy, Duration sendTimeout, MailboxMetrics metrics) {
        this.address = Objects.requireNonNull(address, "address cannot be null");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Creates a handle over a new bounded {@link LinkedMailbox}.
     */
    public static MailboxHandle bounded(Address address, int capacity, BackpressureStrategy strategy,
                                        Duration sendTimeout) {
        return new MailboxHandle(address, new LinkedMailbox<>(capacity), strategy, sendTimeout);
    }

    /**
     * Creates a handle over a new bounded {@link LinkedMailbox} that reports to the given recorder.
     */
    public static MailboxHandle bounded(Address address, int capacity, BackpressureStrategy strategy,
                                        Duration sendTimeout, MailboxMetrics metrics) {
        return new MailboxHandle(address, new LinkedMailbox<>(capacity), strategy, sendTimeout, metrics);
    }

    /**
     * Enqueues the envelope.
     *
     * @return true if enqueued, false if dropped by a {@link BackpressureStrategy#DROP_NEW} mailbox
     * @throws MailboxClosedException if the mailbox is closed
     * @throws MailboxFullException if the mailbox is full and uses {@link BackpressureStrategy#REJECT}
     * @throws SendTimeoutException if a blocking send found no room in time
     */
    public boolean send(MessageEnvelope<?> envelope) {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        if (mailbox.isClosed()) {
            throw new MailboxClosedException(address.toString());
        }
        if (mailbox.offer(envelope)) {
            metrics.recordSent();
            return true;
        }
        if (mailbox.isClosed()) {
            throw new MailboxClosedException(address.toString());
        }

        switch (strategy) {
            case BLOCK:
                return blockingSend(envelope);
            case DROP_NEW:
                metrics.recordDropped();
                logger.debug("Mailbox of {} full, dropping new message {}", address, envelope);
                return false;
            case DROP_OLDEST:
                return dropOldestAndSend(envelope);
            case REJECT:
                throw new MailboxFullException(address.toString(), mailbox.capacity());
            default:
                throw new IllegalStateException("Unknown backpressure strategy: " + strategy);
        }
    }

    private boolean blockingSend(MessageEnvelope<?> envelope) {
        try {
            if (mailbox.offer(envelope, sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                metrics.recordSent();
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SendTimeoutException(address.toString(), sendTimeout, e);
        }
        if (mailbox.isClosed()) {
            throw new MailboxClosedException(address.toString());
        }
        throw new SendTimeoutException(address.toString(), sendTimeout);
    }

    private boolean dropOldestAndSend(MessageEnvelope<?> envelope) {
        while (!mailbox.offer(envelope)) {
            if (mailbox.isClosed()) {
                throw new MailboxClosedException(address.toString());
            }
            MessageEnvelope<?> oldest = mailbox.poll();
            if (oldest != null) {
                metrics.recordDropped();
                logger.debug("Mailbox of {} full, dropped oldest message {}", address, oldest);
            }
        }
        metrics.recordSent();
        return true;
    }

    /**
     * Takes the next message without waiting.
     *
     * @return the next message, or null if none is queued
     */
    public MessageEnvelope<?> poll() {
        MessageEnvelope<?> envelope = pushedBack.pollFirst();
        if (envelope != null) {
            return envelope;
        }
        return received(mailbox.poll());
    }

    /**
     * Takes the next message, waiting up to the given time for one to arrive.
     *
     * @return the next message, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    public MessageEnvelope<?> poll(long timeout, TimeUnit unit) throws InterruptedException {
        MessageEnvelope<?> envelope = pushedBack.pollFirst();
        if (envelope != null) {
            return envelope;
        }
        return received(mailbox.poll(timeout, unit));
    }

    /**
     * Moves up to {@code maxElements} messages into the collection, pushed-back ones first.
     *
     * @return the number of messages transferred
     */
    public int drainTo(Collection<? super MessageEnvelope<?>> collection, int maxElements) {
        int moved = 0;
        MessageEnvelope<?> envelope;
        while (moved < maxElements && (envelope = pushedBack.pollFirst()) != null) {
            collection.add(envelope);
            moved++;
        }
        if (moved < maxElements) {
            int drained = mailbox.drainTo(collection, maxElements - moved);
            for (int i = 0; i < drained; i++) {
                metrics.recordReceived();
            }
            moved += drained;
        }
        return moved;
    }

    /**
     * Hands back messages the consumer took but did not process. They are read again, in
     * the given order, before any other queued message. Capacity does not apply.
     */
    public void pushBack(List<? extends MessageEnvelope<?>> envelopes) {
        for (int i = envelopes.size() - 1; i >= 0; i--) {
            pushedBack.addFirst(envelopes.get(i));
        }
    }

    private MessageEnvelope<?> received(MessageEnvelope<?> envelope) {
        if (envelope != null) {
            metrics.recordReceived();
        }
        return envelope;
    }

    public Address address() {
        return address;
    }

    public BackpressureStrategy strategy() {
        return strategy;
    }

    /**
     * Queued messages, including pushed-back ones.
     */
    public int size() {
        return pushedBack.size() + mailbox.size();
    }

    public int capacity() {
        return mailbox.capacity();
    }

    /**
     * Number of messages discarded by a dropping strategy or on expiry.
     */
    public long droppedCount() {
        return metrics.droppedCount();
    }

    public MailboxMetrics metrics() {
        return metrics;
    }

    public boolean isClosed() {
        return mailbox.isClosed();
    }

    public void close() {
        mailbox.close();
    }

    @Override
    public String toString() {
        return "MailboxHandle{" + address + ", size=" + size() + ", strategy=" + strategy + '}';
    }
}
