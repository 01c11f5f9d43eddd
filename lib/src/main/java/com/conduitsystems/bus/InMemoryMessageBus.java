package com.conduitsystems.bus;

import com.conduitsystems.config.ThreadPoolFactory;
import com.conduitsystems.message.MessageEnvelope;
import com.conduitsystems.monitoring.BrokerEvent;
import com.conduitsystems.monitoring.Monitor;
import com.conduitsystems.monitoring.Monitors;
import com.conduitsystems.monitoring.NoopMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link MessageBus}. Subscribers live in a copy-on-write list, so publishing
 * never locks against other publishers; pending requests live in a concurrent map and are
 * resolved by whichever of reply or timer removes them first.
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final CopyOnWriteArrayList<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<UUID, PendingRequest<?>> pendingRequests = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timeoutScheduler;
    private final boolean ownsScheduler;
    private final Monitor<BrokerEvent> monitor;
    private volatile boolean closed;

    public InMemoryMessageBus() {
        this(NoopMonitor.instance());
    }

    public InMemoryMessageBus(Monitor<BrokerEvent> monitor) {
        this(monitor, new ThreadPoolFactory().setSchedulerThreads(1).createScheduledExecutorService("bus"), true);
    }

    /**
     * @param timeoutScheduler runs request timeouts; not shut down by {@link #close()}
     */
    public InMemoryMessageBus(Monitor<BrokerEvent> monitor, ScheduledExecutorService timeoutScheduler) {
        this(monitor, timeoutScheduler, false);
    }

    private InMemoryMessageBus(Monitor<BrokerEvent> monitor, ScheduledExecutorService timeoutScheduler,
                               boolean ownsScheduler) {
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        this.timeoutScheduler = Objects.requireNonNull(timeoutScheduler, "timeoutScheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public int publish(MessageEnvelope<?> envelope) {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        if (envelope.recipient().isEmpty()) {
            throw routeConfigurationError("Cannot publish " + envelope + ": no recipient", envelope);
        }
        if (closed) {
            throw new BusClosedException();
        }

        int delivered = 0;
        for (Subscription subscription : subscribers) {
            if (subscription.deliver(envelope)) {
                delivered++;
            } else if (subscription.isClosed()) {
                prune(subscription);
            }
        }

        logger.trace("Published {} to {} subscribers", envelope, delivered);
        Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.MESSAGE_PUBLISHED,
                "recipient", envelope.recipient().get(),
                "subscribers", delivered,
                "correlationId", envelope.correlationId().orElse(null)));
        return delivered;
    }

    private RouteConfigurationException routeConfigurationError(String message, MessageEnvelope<?> envelope) {
        Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.ROUTE_CONFIGURATION_ERROR,
                "payloadType", envelope.payload() == null ? null : envelope.payload().getClass().getName(),
                "error", message));
        return new RouteConfigurationException(message);
    }

    private void prune(Subscription subscription) {
        // remove() tells exactly one of several concurrent publishers it did the pruning
        if (subscribers.remove(subscription)) {
            logger.debug("Removed closed subscription {}", subscription.id());
            Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.SUBSCRIBER_REMOVED,
                    "subscription", subscription.id()));
        }
    }

    @Override
    public Subscription subscribe() {
        if (closed) {
            throw new BusClosedException();
        }
        Subscription subscription = new Subscription();
        subscribers.add(subscription);
        logger.debug("Added subscription {}", subscription.id());
        Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.SUBSCRIBER_ADDED,
                "subscription", subscription.id()));
        return subscription;
    }

    @Override
    public <R> CompletableFuture<Optional<MessageEnvelope<R>>> publishRequest(MessageEnvelope<?> envelope,
                                                                             Duration timeout, Class<R> replyType) {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(replyType, "replyType cannot be null");
        if (envelope.recipient().isEmpty()) {
            throw routeConfigurationError("Cannot publish request " + envelope + ": no recipient", envelope);
        }
        if (closed) {
            throw new BusClosedException();
        }

        UUID correlationId = UUID.randomUUID();
        Instant now = Instant.now();
        PendingRequest<R> request = new PendingRequest<>(correlationId, replyType, new CompletableFuture<>(),
                now, now.plus(timeout));
        pendingRequests.put(correlationId, request);

        ScheduledFuture<?> timer;
        try {
            timer = timeoutScheduler.schedule(() -> expire(request), timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            pendingRequests.remove(correlationId, request);
            throw new BusClosedException();
        }
        request.future().whenComplete((reply, error) -> timer.cancel(false));

        try {
            publish(envelope.withCorrelationId(correlationId));
        } catch (RuntimeException e) {
            if (pendingRequests.remove(correlationId, request)) {
                request.future().completeExceptionally(e);
            }
            return request.future();
        }
        logger.debug("Issued request {} to {} (timeout {}ms)", correlationId, envelope.recipient().get(),
                timeout.toMillis());
        return request.future();
    }

    private void expire(PendingRequest<?> request) {
        if (pendingRequests.remove(request.correlationId(), request)) {
            logger.debug("Request {} timed out", request.correlationId());
            Monitors.recordQuietly(monitor, BrokerEvent.of(BrokerEvent.Kind.REQUEST_TIMED_OUT,
                    "correlationId", request.correlationId()));
            request.expire();
        }
    }

    @Override
    public boolean publishReply(MessageEnvelope<?> reply) {
        Objects.requireNonNull(reply, "reply cannot be null");
        Optional<UUID> correlationId = reply.correlationId();
        if (correlationId.isEmpty()) {
            logger.warn("Discarding reply without correlation id: {}", reply);
            return false;
        }
        PendingRequest<?> request = pendingRequests.remove(correlationId.get());
        if (request == null) {
            logger.debug("Discarding late or duplicate reply {}", correlationId.get());
            return false;
        }
        request.complete(reply);
        return true;
    }

    @Override
    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    @Override
    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscribers) {
            subscription.close();
        }
        subscribers.clear();
        for (UUID correlationId : pendingRequests.keySet()) {
            PendingRequest<?> request = pendingRequests.remove(correlationId);
            if (request != null) {
                request.expire();
            }
        }
        if (ownsScheduler) {
            timeoutScheduler.shutdownNow();
        }
        logger.info("Message bus closed");
    }
}
