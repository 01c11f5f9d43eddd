package com.conduitsystems.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded multi-producer single-consumer mailbox on top of the JCTools
 * {@link MpscUnboundedArrayQueue}. Enqueueing is lock-free; only a consumer that has to
 * wait takes the lock. This is the stream behind every bus subscription: publishers on
 * any thread, one reader.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean hasWaitingConsumers;
    private volatile boolean closed;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param chunkSize the initial chunk size, rounded up to a power of two (at least 2)
     */
    public MpscMailbox(int chunkSize) {
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(Math.max(2, chunkSize)));
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (closed) {
            return false;
        }
        boolean added = queue.offer(message);
        if (added) {
            signalNotEmpty();
        }
        return added;
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) {
        // never full, so there is nothing to wait for
        return offer(message);
    }

    @Override
    public void put(T message) {
        if (!offer(message)) {
            throw new IllegalStateException("Mailbox is closed");
        }
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            hasWaitingConsumers = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            hasWaitingConsumers = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            hasWaitingConsumers = true;
            while ((message = queue.poll()) == null) {
                notEmpty.await();
            }
            return message;
        } finally {
            hasWaitingConsumers = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        if (collection == this) {
            throw new IllegalArgumentException("Cannot drain to self");
        }
        int count = 0;
        T message;
        while (count < maxElements && (message = queue.poll()) != null) {
            collection.add(message);
            count++;
        }
        return count;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return Integer.MAX_VALUE;
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * Only takes the lock when a consumer may be parked, so the producer hot path stays
     * lock-free.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumers) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    private static int nextPowerOfTwo(int value) {
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
