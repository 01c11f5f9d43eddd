package com.conduitsystems.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Abstraction over the queue behind an actor mailbox or a bus subscription.
 * Producers may be many; the consumer side is expected to be a single thread.
 *
 * <p>A mailbox can be closed. Once closed it accepts no new messages: {@code offer}
 * returns false and {@code put} throws {@link IllegalStateException}. Messages already
 * queued stay available to the consumer until drained or cleared.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the message if it is possible to do so immediately without exceeding
     * capacity.
     *
     * @param message the message to add
     * @return true if the message was added, false if the mailbox is full or closed
     */
    boolean offer(T message);

    /**
     * Inserts the message, waiting up to the given time for space to become available.
     *
     * @param message the message to add
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if successful, false if the timeout elapsed or the mailbox is closed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Inserts the message, waiting if necessary for space to become available.
     *
     * @param message the message to add
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if the mailbox is closed
     */
    void put(T message) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the given time
     * for a message to become available.
     *
     * @return the head of this mailbox, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, waiting until a message arrives.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Moves up to {@code maxElements} queued messages into the given collection.
     *
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    int size();

    boolean isEmpty();

    /**
     * Returns the number of additional messages this mailbox can accept without
     * blocking, or Integer.MAX_VALUE if unbounded.
     */
    int remainingCapacity();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();

    /**
     * Stops the mailbox from accepting new messages. Idempotent.
     */
    void close();

    boolean isClosed();

    /**
     * Returns the total capacity of this mailbox (size + remaining capacity), or
     * Integer.MAX_VALUE if unbounded.
     */
    default int capacity() {
        int size = size();
        int remaining = remainingCapacity();
        if (remaining == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return size + remaining;
    }
}
