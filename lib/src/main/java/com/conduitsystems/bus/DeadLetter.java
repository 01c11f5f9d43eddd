package com.conduitsystems.bus;

import com.conduitsystems.message.MessageEnvelope;

import java.time.Instant;

/**
 * An envelope the router could not deliver, with the reason.
 */
public record DeadLetter(MessageEnvelope<?> envelope, Reason reason, String detail, Instant timestamp) {

    public enum Reason {
        ADDRESS_NOT_FOUND,
        MAILBOX_CLOSED,
        MAILBOX_FULL,
        SEND_TIMEOUT,
        EXPIRED,
        SHUTDOWN,
        DELIVERY_FAILED
    }

    public static DeadLetter of(MessageEnvelope<?> envelope, Reason reason, String detail) {
        return new DeadLetter(envelope, reason, detail, Instant.now());
    }
}
