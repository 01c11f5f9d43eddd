package com.conduitsystems.message;

import com.conduitsystems.address.Address;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageEnvelopeTest {

    private static final Address CLIENT = Address.named("client");
    private static final Address SERVER = Address.named("server");

    @Test
    void withersKeepOtherFields() {
        UUID correlationId = UUID.randomUUID();
        MessageEnvelope<String> envelope = MessageEnvelope.to(SERVER, "hello")
                .withSender(CLIENT)
                .withCorrelationId(correlationId)
                .withPriority(MessagePriority.HIGH);

        MessageEnvelope<Integer> changed = envelope.withPayload(42);

        assertEquals(42, changed.payload());
        assertEquals(SERVER, changed.recipient().orElseThrow());
        assertEquals(CLIENT, changed.sender().orElseThrow());
        assertEquals(correlationId, changed.correlationId().orElseThrow());
        assertEquals(MessagePriority.HIGH, changed.priority());
        assertEquals(envelope.timestamp(), changed.timestamp());
    }

    @Test
    void replyGoesToReplyToBeforeSender() {
        Address inbox = Address.named("inbox");
        UUID correlationId = UUID.randomUUID();
        MessageEnvelope<String> request = MessageEnvelope.to(SERVER, "ping")
                .withSender(CLIENT)
                .withCorrelationId(correlationId);

        MessageEnvelope<TypedReply<String>> reply = request.reply(SERVER, String.class, "pong");
        assertEquals(CLIENT, reply.recipient().orElseThrow());
        assertEquals(SERVER, reply.sender().orElseThrow());
        assertEquals(correlationId, reply.correlationId().orElseThrow());
        assertEquals("pong", reply.payload().unwrap(String.class));

        MessageEnvelope<TypedReply<String>> redirected = request.withReplyTo(inbox).reply(SERVER, String.class, "pong");
        assertEquals(inbox, redirected.recipient().orElseThrow());
    }

    @Test
    void ttlExpiry() {
        MessageEnvelope<String> envelope = MessageEnvelope.to(SERVER, "soon stale").withTtl(Duration.ofSeconds(1));

        assertFalse(envelope.isExpired(envelope.timestamp().plusMillis(500)));
        assertTrue(envelope.isExpired(envelope.timestamp().plusMillis(1500)));
        assertFalse(MessageEnvelope.to(SERVER, "forever").isExpired(Instant.now().plusSeconds(3600)));
    }

    @Test
    void nonPositiveTtlIsRejected() {
        MessageEnvelope<String> envelope = MessageEnvelope.to(SERVER, "x");
        assertThrows(IllegalArgumentException.class, () -> envelope.withTtl(Duration.ZERO));
    }

    @Test
    void typedReplyChecksTag() {
        TypedReply<Integer> reply = TypedReply.of(Integer.class, 7);

        assertEquals(7, reply.unwrap(Integer.class));
        assertEquals(7, reply.unwrap(Number.class).intValue());
        ReplyTypeMismatchException e = assertThrows(ReplyTypeMismatchException.class,
                () -> reply.unwrap(String.class));
        assertEquals(String.class, e.getExpected());
        assertEquals(Integer.class, e.getActual());
    }
}
