package com.conduitsystems.bus;

import com.conduitsystems.BrokerException;
import com.conduitsystems.address.Address;
import com.conduitsystems.config.ThreadPoolFactory;
import com.conduitsystems.mailbox.MailboxClosedException;
import com.conduitsystems.mailbox.MailboxFullException;
import com.conduitsystems.mailbox.MailboxHandle;
import com.conduitsystems.mailbox.SendTimeoutException;
import com.conduitsystems.message.MessageEnvelope;
import com.conduitsystems.monitoring.BrokerEvent;
import com.conduitsystems.monitoring.Monitor;
import com.conduitsystems.monitoring.Monitors;
import com.conduitsystems.registry.ActorRegistry;
import com.conduitsystems.registry.AddressNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The system loop that moves envelopes from the bus into actor mailboxes.
 *
 * <p>Subscribes once when started, then for every envelope resolves the recipient in the
 * registry and sends into its mailbox. Anything that cannot be delivered (unknown
 * recipient, closed or full mailbox, expired TTL) goes to the {@link DeadLetterOffice};
 * the loop itself keeps running.
 */
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(50);

    private final MessageBus bus;
    private final ActorRegistry registry;
    private final DeadLetterOffice deadLetters;
    private final Monitor<BrokerEvent> monitor;
    private final ThreadPoolFactory threadPoolFactory;
    private final AtomicLong routed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running;
    private volatile Thread thread;
    private volatile Subscription subscription;

    public MessageRouter(MessageBus bus, ActorRegistry registry, DeadLetterOffice deadLetters,
                         Monitor<BrokerEvent> monitor, ThreadPoolFactory threadPoolFactory) {
        this.bus = Objects.requireNonNull(bus, "bus cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters cannot be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
    }

    /**
     * Subscribes to the bus and starts the routing thread. Returns once the thread runs.
     */
    public synchronized void start() {
        if (running) {
            logger.debug("Router already running");
            return;
        }
        subscription = bus.subscribe();
        running = true;

        CountDownLatch ready = new CountDownLatch(1);
        thread = threadPoolFactory.createThreadFactory("router").newThread(() -> {
            ready.countDown();
            routeLoop();
        });
        thread.start();
        try {
            if (!ready.await(5, TimeUnit.SECONDS)) {
                logger.warn("Router thread did not start within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Message router started");
    }

    private void routeLoop() {
        while (running) {
            MessageEnvelope<?> envelope;
            try {
                envelope = subscription.poll(POLL_TIMEOUT);
            } catch (InterruptedException e) {
                if (running) {
                    logger.debug("Router interrupted while running, continuing");
                    continue;
                }
                Thread.currentThread().interrupt();
                break;
            }
            if (envelope != null) {
                route(envelope);
            }
        }
        logger.debug("Router loop exited");
    }

    /**
     * Delivers one envelope, dead-lettering it on failure. Never throws.
     */
    void route(MessageEnvelope<?> envelope) {
        if (envelope.isExpired()) {
            fail(envelope, DeadLetter.Reason.EXPIRED, "ttl of " + envelope.ttl().orElse(null) + " elapsed");
            return;
        }
        Address recipient = envelope.recipient().orElse(null);
        if (recipient == null) {
            fail(envelope, DeadLetter.Reason.ADDRESS_NOT_FOUND, "no recipient");
            return;
        }

        try {
            MailboxHandle mailbox = registry.resolve(recipient);
            if (!mailbox.send(envelope)) {
                fail(envelope, DeadLetter.Reason.MAILBOX_FULL, "dropped by " + mailbox.strategy());
                return;
            }
            routed.incrementAndGet();
            Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.MESSAGE_ROUTED,
                    "recipient", recipient));
        } catch (AddressNotFoundException e) {
            fail(envelope, DeadLetter.Reason.ADDRESS_NOT_FOUND, e.getMessage());
        } catch (MailboxClosedException e) {
            fail(envelope, DeadLetter.Reason.MAILBOX_CLOSED, e.getMessage());
        } catch (MailboxFullException e) {
            fail(envelope, DeadLetter.Reason.MAILBOX_FULL, e.getMessage());
        } catch (SendTimeoutException e) {
            fail(envelope, DeadLetter.Reason.SEND_TIMEOUT, e.getMessage());
        } catch (BrokerException e) {
            fail(envelope, DeadLetter.Reason.DELIVERY_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error routing {}", envelope, e);
            fail(envelope, DeadLetter.Reason.DELIVERY_FAILED, String.valueOf(e));
        }
    }

    private void fail(MessageEnvelope<?> envelope, DeadLetter.Reason reason, String detail) {
        failed.incrementAndGet();
        Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.ROUTING_FAILED,
                "reason", reason,
                "recipient", envelope.recipient().orElse(null)));
        deadLetters.post(DeadLetter.of(envelope, reason, detail));
    }

    /**
     * Stops taking new envelopes, waits up to {@code timeout} for the in-flight delivery,
     * then dead-letters whatever the subscription still holds.
     */
    public void stop(Duration timeout) {
        Thread routerThread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            routerThread = thread;
            thread = null;
        }

        if (routerThread != null && routerThread != Thread.currentThread()) {
            try {
                routerThread.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (routerThread.isAlive()) {
                logger.warn("Router did not finish in-flight delivery within {}ms, interrupting", timeout.toMillis());
                routerThread.interrupt();
                try {
                    routerThread.join(timeout.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        subscription.close();
        List<MessageEnvelope<?>> unrouted = subscription.drain();
        for (MessageEnvelope<?> envelope : unrouted) {
            fail(envelope, DeadLetter.Reason.SHUTDOWN, "router stopped");
        }
        logger.info("Message router stopped ({} routed, {} failed)", routed.get(), failed.get());
    }

    public boolean isRunning() {
        return running;
    }

    public long routedCount() {
        return routed.get();
    }

    public long failedCount() {
        return failed.get();
    }
}
