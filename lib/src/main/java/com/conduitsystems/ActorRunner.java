package com.conduitsystems;

import com.conduitsystems.config.ThreadPoolFactory;
import com.conduitsystems.handler.Handler;
import com.conduitsystems.mailbox.MailboxHandle;
import com.conduitsystems.message.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Encapsulates mailbox polling and message dispatch for one actor incarnation.
 * A crash ends the loop and is passed to the failure callback; the mailbox itself
 * survives and is picked up by the next incarnation, starting with whatever this one
 * drained but did not process.
 *
 * @param <T> The type of messages the handler processes
 */
class ActorRunner<T> {
    private static final Logger logger = LoggerFactory.getLogger(ActorRunner.class);

    private static final long POLL_TIMEOUT_MS = 10;
    private static final long READY_TIMEOUT_MS = 5000;

    private final String actorId;
    private final MailboxHandle mailbox;
    private final Handler<T> handler;
    private final DefaultActorContext context;
    private final int batchSize;
    private final Consumer<Throwable> failureCallback;
    private final ThreadPoolFactory threadPoolFactory;
    private final List<MessageEnvelope<?>> batchBuffer;

    private volatile boolean running = false;
    private volatile boolean crashed = false;
    private volatile Thread thread;
    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final CountDownLatch doneLatch = new CountDownLatch(1);

    /**
     * @param failureCallback receives the error that crashed the actor, once
     */
    ActorRunner(String actorId, MailboxHandle mailbox, Handler<T> handler, DefaultActorContext context,
                int batchSize, Consumer<Throwable> failureCallback, ThreadPoolFactory threadPoolFactory) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.handler = handler;
        this.context = context;
        this.batchSize = batchSize;
        this.failureCallback = failureCallback;
        this.threadPoolFactory = threadPoolFactory;
        this.batchBuffer = new ArrayList<>(batchSize);
    }

    /**
     * Runs the handler's preStart, then starts the processing thread and waits until it is
     * polling.
     */
    void start() {
        if (running) {
            logger.debug("Actor {} already running", actorId);
            return;
        }
        handler.preStart(context);
        running = true;
        thread = threadPoolFactory.createThreadFactory("actor-" + actorId).newThread(this::processMailboxLoop);
        thread.start();
        try {
            if (!readyLatch.await(READY_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("Actor {} did not start within timeout", actorId);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for actor {} to start", actorId);
            Thread.currentThread().interrupt();
        }
        logger.debug("Actor {} started", actorId);
    }

    /**
     * Stops polling after the message in progress and waits for the loop to end.
     * Messages still queued stay in the mailbox.
     *
     * @return true if the loop ended within the timeout
     */
    boolean stop(Duration timeout) throws InterruptedException {
        running = false;
        Thread current = thread;
        boolean finished = current == null || Thread.currentThread() == current
                || doneLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            logger.warn("Actor {} did not stop within {}ms", actorId, timeout.toMillis());
        }
        return finished;
    }

    /**
     * Interrupts the processing thread without waiting.
     */
    void terminate() {
        running = false;
        Thread current = thread;
        if (current != null) {
            current.interrupt();
        }
    }

    boolean isRunning() {
        return running;
    }

    /**
     * True once a message crashed the actor.
     */
    boolean isCrashed() {
        return crashed;
    }

    @SuppressWarnings("unchecked")
    private void processMailboxLoop() {
        readyLatch.countDown();
        try {
            while (running) {
                batchBuffer.clear();
                MessageEnvelope<?> first = mailbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batchBuffer.add(first);
                if (batchSize > 1) {
                    mailbox.drainTo(batchBuffer, batchSize - 1);
                }
                for (int i = 0; i < batchBuffer.size(); i++) {
                    MessageEnvelope<?> envelope = batchBuffer.get(i);
                    if (!running) {
                        requeue(i);
                        break;
                    }
                    if (envelope.isExpired()) {
                        mailbox.metrics().recordDropped();
                        logger.debug("Actor {} skipping expired message {}", actorId, envelope);
                        continue;
                    }
                    T message = (T) envelope.payload();
                    context.current(envelope);
                    try {
                        handler.receive(message, context);
                    } catch (Throwable e) {
                        if (!recover(message, e)) {
                            requeue(i + 1);
                            crash(e);
                            return;
                        }
                    } finally {
                        context.current(null);
                    }
                }
            }
        } catch (InterruptedException e) {
            logger.debug("Actor {} mailbox interrupted", actorId);
            Thread.currentThread().interrupt();
        } finally {
            finish();
        }
    }

    private boolean recover(T message, Throwable error) {
        logger.error("Actor {} error processing message: {}", actorId, message, error);
        try {
            return handler.onError(message, error, context);
        } catch (Throwable e) {
            logger.error("Actor {} error handler threw", actorId, e);
            return false;
        }
    }

    // the unprocessed tail of a drained batch goes back to the head of the mailbox
    private void requeue(int from) {
        if (from < batchBuffer.size()) {
            List<MessageEnvelope<?>> tail = new ArrayList<>(batchBuffer.subList(from, batchBuffer.size()));
            mailbox.pushBack(tail);
            logger.debug("Actor {} handed back {} unprocessed messages", actorId, tail.size());
        }
        batchBuffer.clear();
    }

    private void crash(Throwable error) {
        crashed = true;
        running = false;
        failureCallback.accept(error);
    }

    private void finish() {
        running = false;
        try {
            handler.postStop(context);
        } catch (RuntimeException e) {
            logger.warn("Actor {} postStop threw", actorId, e);
        }
        thread = null;
        doneLatch.countDown();
        logger.debug("Actor {} stopped", actorId);
    }
}
