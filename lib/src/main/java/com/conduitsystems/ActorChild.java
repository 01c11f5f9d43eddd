package com.conduitsystems;

import com.conduitsystems.address.Address;
import com.conduitsystems.config.ThreadPoolFactory;
import com.conduitsystems.handler.Handler;
import com.conduitsystems.mailbox.MailboxHandle;
import com.conduitsystems.supervisor.Child;
import com.conduitsystems.supervisor.ChildContext;
import com.conduitsystems.supervisor.ChildHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * One incarnation of an actor, as run by a supervisor. Every restart builds a new
 * {@code ActorChild} with a new handler; the mailbox handle and the registry entry are
 * shared by all incarnations, so messages sent during a restart wait in the mailbox.
 *
 * @param <T> The type of messages the actor processes
 */
class ActorChild<T> implements Child {

    private static final Logger logger = LoggerFactory.getLogger(ActorChild.class);

    /** Mailbox fill ratio above which the actor reports itself degraded. */
    static final double DEGRADED_FILL_RATIO = 0.9;

    private final ActorSystem system;
    private final MailboxHandle mailbox;
    private final Supplier<? extends Handler<T>> handlerFactory;
    private final int batchSize;
    private final ThreadPoolFactory threadPoolFactory;

    private volatile ChildContext childContext;
    private volatile ActorRunner<T> runner;

    ActorChild(ActorSystem system, MailboxHandle mailbox, Supplier<? extends Handler<T>> handlerFactory,
               int batchSize, ThreadPoolFactory threadPoolFactory) {
        this.system = system;
        this.mailbox = mailbox;
        this.handlerFactory = handlerFactory;
        this.batchSize = batchSize;
        this.threadPoolFactory = threadPoolFactory;
    }

    Address address() {
        return mailbox.address();
    }

    @Override
    public void attach(ChildContext context) {
        this.childContext = context;
    }

    @Override
    public void start() {
        Handler<T> handler = handlerFactory.get();
        if (handler == null) {
            throw new ActorSpawnException(address(), "handler factory returned null");
        }
        ActorRunner<T> created = new ActorRunner<>(address().path(), mailbox, handler,
                new DefaultActorContext(system, address()), batchSize, this::crashed, threadPoolFactory);
        system.registry().register(address(), mailbox);
        created.start();
        runner = created;
    }

    private void crashed(Throwable error) {
        ChildContext context = childContext;
        if (context == null) {
            logger.error("Actor {} crashed with no supervisor attached", address(), error);
            return;
        }
        context.reportFailure(error);
    }

    @Override
    public void stop(Duration timeout) throws InterruptedException {
        ActorRunner<T> current = runner;
        if (current != null && !current.stop(timeout)) {
            current.terminate();
        }
    }

    @Override
    public void terminate() {
        ActorRunner<T> current = runner;
        if (current != null) {
            current.terminate();
        }
    }

    /**
     * Failed if the actor crashed, degraded if its mailbox is nearly full.
     */
    @Override
    public ChildHealth healthCheck() {
        ActorRunner<T> current = runner;
        if (current == null || current.isCrashed() || !current.isRunning()) {
            return ChildHealth.failed("actor " + address() + " is not processing messages");
        }
        int capacity = mailbox.capacity();
        if (capacity > 0 && capacity != Integer.MAX_VALUE
                && mailbox.size() > capacity * DEGRADED_FILL_RATIO) {
            return ChildHealth.degraded("mailbox of " + address() + " is " + mailbox.size() + "/" + capacity);
        }
        return ChildHealth.healthy();
    }
}
