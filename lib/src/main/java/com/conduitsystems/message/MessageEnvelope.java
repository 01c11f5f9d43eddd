package com.conduitsystems.message;

import com.conduitsystems.address.Address;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable wrapper around a payload with its routing metadata. All {@code with*} methods
 * return a modified copy; the creation timestamp is kept.
 *
 * @param <T> the payload type
 */
public final class MessageEnvelope<T> {

    private final T payload;
    private final Address sender;
    private final Address recipient;
    private final UUID correlationId;
    private final Address replyTo;
    private final Duration ttl;
    private final MessagePriority priority;
    private final Instant timestamp;

    private MessageEnvelope(T payload, Address sender, Address recipient, UUID correlationId,
                            Address replyTo, Duration ttl, MessagePriority priority, Instant timestamp) {
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
        this.sender = sender;
        this.recipient = recipient;
        this.correlationId = correlationId;
        this.replyTo = replyTo;
        this.ttl = ttl;
        this.priority = Objects.requireNonNull(priority, "priority cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    /**
     * Creates an envelope with no routing information and {@link MessagePriority#NORMAL}.
     */
    public static <T> MessageEnvelope<T> of(T payload) {
        return new MessageEnvelope<>(payload, null, null, null, null, null, MessagePriority.NORMAL, Instant.now());
    }

    /**
     * Creates an envelope addressed to {@code recipient}.
     */
    public static <T> MessageEnvelope<T> to(Address recipient, T payload) {
        return of(payload).withRecipient(recipient);
    }

    public T payload() {
        return payload;
    }

    public Optional<Address> sender() {
        return Optional.ofNullable(sender);
    }

    public Optional<Address> recipient() {
        return Optional.ofNullable(recipient);
    }

    public Optional<UUID> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    public Optional<Address> replyTo() {
        return Optional.ofNullable(replyTo);
    }

    public Optional<Duration> ttl() {
        return Optional.ofNullable(ttl);
    }

    public MessagePriority priority() {
        return priority;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public MessageEnvelope<T> withSender(Address sender) {
        return new MessageEnvelope<>(payload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    public MessageEnvelope<T> withRecipient(Address recipient) {
        return new MessageEnvelope<>(payload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    public MessageEnvelope<T> withCorrelationId(UUID correlationId) {
        return new MessageEnvelope<>(payload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    public MessageEnvelope<T> withReplyTo(Address replyTo) {
        return new MessageEnvelope<>(payload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    public MessageEnvelope<T> withTtl(Duration ttl) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        return new MessageEnvelope<>(payload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    public MessageEnvelope<T> withPriority(MessagePriority priority) {
        return new MessageEnvelope<>(payload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    /**
     * Returns a copy carrying a different payload and the same metadata.
     */
    public <R> MessageEnvelope<R> withPayload(R newPayload) {
        return new MessageEnvelope<>(newPayload, sender, recipient, correlationId, replyTo, ttl, priority, timestamp);
    }

    /**
     * Builds the reply to this envelope: addressed to its reply-to (or sender), same
     * correlation id, the payload boxed with its runtime type.
     */
    public <R> MessageEnvelope<TypedReply<R>> reply(Address from, Class<R> type, R value) {
        Address target = replyTo != null ? replyTo : sender;
        return new MessageEnvelope<>(TypedReply.of(type, value), from, target, correlationId, null, null,
                priority, Instant.now());
    }

    public boolean isExpired() {
        return isExpired(Instant.now());
    }

    public boolean isExpired(Instant now) {
        return ttl != null && now.isAfter(timestamp.plus(ttl));
    }

    @Override
    public String toString() {
        return "MessageEnvelope{payload=" + payload
                + ", sender=" + sender
                + ", recipient=" + recipient
                + (correlationId != null ? ", correlationId=" + correlationId : "")
                + ", priority=" + priority + '}';
    }
}
