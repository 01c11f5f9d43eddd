package com.conduitsystems.mailbox;

import java.time.Instant;
import java.util.Optional;

/**
 * Records traffic through one actor mailbox. Implementations are shared between the
 * senders and the consuming actor, so every method must be safe to call from any thread.
 *
 * @see AtomicMailboxMetrics
 */
public interface MailboxMetrics {

    /**
     * A message was accepted into the mailbox.
     */
    void recordSent();

    /**
     * The consumer took a message out of the mailbox. Messages handed back after a
     * crash are not counted twice.
     */
    void recordReceived();

    /**
     * A message was discarded by a dropping backpressure strategy or because it expired.
     */
    void recordDropped();

    long sentCount();

    long receivedCount();

    long droppedCount();

    /**
     * When the consumer last took a message, empty if it never did.
     */
    Optional<Instant> lastMessageAt();
}
