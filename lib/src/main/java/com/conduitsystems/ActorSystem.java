package com.conduitsystems;

import com.conduitsystems.address.Address;
import com.conduitsystems.bus.DeadLetter;
import com.conduitsystems.bus.DeadLetterOffice;
import com.conduitsystems.bus.InMemoryMessageBus;
import com.conduitsystems.bus.MessageBus;
import com.conduitsystems.bus.MessageRouter;
import com.conduitsystems.config.SystemConfig;
import com.conduitsystems.handler.Handler;
import com.conduitsystems.mailbox.MailboxHandle;
import com.conduitsystems.mailbox.MailboxMetrics;
import com.conduitsystems.message.MessageEnvelope;
import com.conduitsystems.registry.ActorRegistry;
import com.conduitsystems.registry.AddressNotFoundException;
import com.conduitsystems.supervisor.ChildId;
import com.conduitsystems.supervisor.ChildNotFoundException;
import com.conduitsystems.supervisor.ChildSpec;
import com.conduitsystems.supervisor.RestartPolicy;
import com.conduitsystems.supervisor.ShutdownPolicy;
import com.conduitsystems.supervisor.SupervisionStrategy;
import com.conduitsystems.supervisor.SupervisorConfig;
import com.conduitsystems.supervisor.SupervisorException;
import com.conduitsystems.supervisor.SupervisorId;
import com.conduitsystems.supervisor.SupervisorNode;
import com.conduitsystems.supervisor.SupervisorTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Wires the routing bus and the supervision engine into a runnable actor system.
 *
 * <p>Messages travel: {@link #tell} publishes on the {@link MessageBus}, the
 * {@link MessageRouter} resolves the recipient in the {@link ActorRegistry} and puts the
 * envelope into its mailbox, the actor's runner hands it to the {@link Handler}. Every
 * spawned actor is a child of the root "user" supervisor; a handler that throws is
 * restarted according to its {@link RestartPolicy}.
 */
public class ActorSystem {

    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    /** Name of the root supervisor that owns spawned actors. */
    public static final String USER_SUPERVISOR = "user";

    private final SystemConfig config;
    private final ActorRegistry registry;
    private final InMemoryMessageBus bus;
    private final DeadLetterOffice deadLetters;
    private final MessageRouter router;
    private final SupervisorTree supervisorTree;
    private final SupervisorId userSupervisorId;
    private final SupervisorNode userSupervisor;
    private final Map<Address, ChildId> actors = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public ActorSystem() {
        this(new SystemConfig());
    }

    public ActorSystem(SystemConfig config) {
        config.validate();
        this.config = config;
        this.registry = new ActorRegistry();
        this.bus = new InMemoryMessageBus(config.getBrokerMonitor());
        this.deadLetters = new DeadLetterOffice(config.getDeadLetterCapacity(), config.getBrokerMonitor());
        this.router = new MessageRouter(bus, registry, deadLetters, config.getBrokerMonitor(),
                config.getThreadPoolFactory());
        this.supervisorTree = new SupervisorTree();
        this.userSupervisorId = supervisorTree.createSupervisor(null, SupervisorConfig.named(USER_SUPERVISOR)
                .setStrategy(SupervisionStrategy.ONE_FOR_ONE)
                .setMonitor(config.getSupervisionMonitor())
                .setThreadPoolFactory(config.getThreadPoolFactory()));
        this.userSupervisor = supervisorTree.supervisor(userSupervisorId).orElseThrow();
        router.start();
        logger.info("Actor system started");
    }

    /**
     * Spawns a permanent actor under {@code address}.
     *
     * @throws ActorSpawnException if the address is taken or the actor failed to start
     * @throws ActorLimitExceededException if the system runs its maximum number of actors
     */
    public <T> Address spawn(Address address, Supplier<? extends Handler<T>> handlerFactory) {
        return spawn(address, handlerFactory, RestartPolicy.PERMANENT);
    }

    /**
     * Spawns a permanent actor under a fresh anonymous address.
     */
    public <T> Address spawn(Supplier<? extends Handler<T>> handlerFactory) {
        return spawn(Address.anonymous(), handlerFactory, RestartPolicy.PERMANENT);
    }

    /**
     * Spawns an actor under {@code address}, supervised by the user supervisor.
     *
     * @throws ActorSpawnException if the address is taken or the actor failed to start
     * @throws ActorLimitExceededException if the system runs its maximum number of actors
     */
    public synchronized <T> Address spawn(Address address, Supplier<? extends Handler<T>> handlerFactory,
                                          RestartPolicy restartPolicy) {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(handlerFactory, "handlerFactory cannot be null");
        ensureRunning();
        if (config.getMaxActors() > 0 && actors.size() >= config.getMaxActors()) {
            throw new ActorLimitExceededException(config.getMaxActors());
        }
        if (actors.containsKey(address) || registry.contains(address)) {
            throw new ActorSpawnException(address, "address already registered");
        }

        ChildSpec spec = childSpec(address, handlerFactory, restartPolicy);
        ChildId childId;
        try {
            childId = userSupervisor.startChild(spec);
        } catch (SupervisorException e) {
            release(address);
            throw new ActorSpawnException(address, e.getMessage(), e);
        }
        actors.put(address, childId);
        logger.debug("Spawned actor {}", address);
        return address;
    }

    /**
     * Builds the supervision spec of an actor, for running it under a supervisor of your
     * own. The actor's mailbox is created here and shared by all its incarnations.
     */
    public <T> ChildSpec childSpec(Address address, Supplier<? extends Handler<T>> handlerFactory,
                                   RestartPolicy restartPolicy) {
        MailboxHandle mailbox = MailboxHandle.bounded(address, config.getMailboxCapacity(),
                config.getBackpressureStrategy(), config.getSendTimeout());
        return ChildSpec.builder(address.path(), () -> new ActorChild<T>(this, mailbox, handlerFactory,
                        config.getBatchSize(), config.getThreadPoolFactory()))
                .restartPolicy(restartPolicy)
                .startTimeout(config.getSpawnTimeout())
                .shutdownTimeout(config.getShutdownTimeout())
                .shutdownPolicy(ShutdownPolicy.graceful(config.getShutdownTimeout()))
                .build();
    }

    /**
     * Sends a message without a sender.
     *
     * @return the number of bus subscribers that took the message
     */
    public int tell(Address target, Object message) {
        ensureRunning();
        return bus.publish(MessageEnvelope.to(target, message));
    }

    /**
     * Sends a message on behalf of {@code sender}, which becomes the reply target.
     */
    public int tell(Address sender, Address target, Object message) {
        ensureRunning();
        return bus.publish(MessageEnvelope.to(target, message).withSender(sender));
    }

    /**
     * Sends a request and completes with the handler's {@link ActorContext#reply}, or with
     * empty if no reply arrives within {@code timeout}.
     */
    public <R> CompletableFuture<Optional<R>> ask(Address target, Object message, Duration timeout,
                                                  Class<R> replyType) {
        ensureRunning();
        return bus.publishRequest(MessageEnvelope.to(target, message), timeout, replyType)
                .thenApply(reply -> reply.map(MessageEnvelope::payload));
    }

    /**
     * Stops the actor, unregisters it and dead-letters the messages left in its mailbox.
     *
     * @throws AddressNotFoundException if no such actor exists
     */
    public synchronized void stop(Address address) {
        ChildId childId = actors.remove(address);
        if (childId == null && !registry.contains(address)) {
            throw new AddressNotFoundException(address);
        }
        try {
            if (childId != null) {
                userSupervisor.stopChild(childId);
            }
        } catch (ChildNotFoundException e) {
            // a temporary actor that crashed is already gone from its supervisor
            logger.debug("Actor {} was no longer supervised", address);
        } finally {
            release(address);
        }
        logger.debug("Stopped actor {}", address);
    }

    private void release(Address address) {
        registry.find(address).ifPresent(mailbox -> {
            registry.unregister(address);
            mailbox.close();
            MessageEnvelope<?> left;
            while ((left = mailbox.poll()) != null) {
                deadLetters.post(DeadLetter.of(left, DeadLetter.Reason.SHUTDOWN, "actor " + address + " stopped"));
            }
        });
    }

    /**
     * Stops routing, stops every actor in reverse spawn order and closes the bus.
     */
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        logger.info("Shutting down actor system ({} actors)", actors.size());
        router.stop(config.getShutdownTimeout());
        supervisorTree.shutdown();
        actors.clear();
        bus.close();
        registry.close();
        logger.info("Actor system stopped ({} dead letters)", deadLetters.totalCount());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public boolean isRunning(Address address) {
        return actors.containsKey(address);
    }

    /**
     * Traffic counters of a live actor's mailbox.
     */
    public Optional<MailboxMetrics> mailboxMetrics(Address address) {
        return registry.find(address).map(MailboxHandle::metrics);
    }

    public int actorCount() {
        return actors.size();
    }

    public ActorRegistry registry() {
        return registry;
    }

    public MessageBus messageBus() {
        return bus;
    }

    public DeadLetterOffice deadLetters() {
        return deadLetters;
    }

    public MessageRouter router() {
        return router;
    }

    public SupervisorTree supervisorTree() {
        return supervisorTree;
    }

    /**
     * The root supervisor every spawned actor runs under.
     */
    public SupervisorNode userSupervisor() {
        return userSupervisor;
    }

    public SupervisorId userSupervisorId() {
        return userSupervisorId;
    }

    public SystemConfig getConfig() {
        return config;
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new ConduitException("Actor system is shut down");
        }
    }
}
