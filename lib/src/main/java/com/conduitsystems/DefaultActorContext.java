package com.conduitsystems;

import com.conduitsystems.address.Address;
import com.conduitsystems.message.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The {@link ActorContext} handed to a handler. The current envelope is set by the
 * runner around each {@code receive} call, always from the actor's own thread.
 */
class DefaultActorContext implements ActorContext {

    private final ActorSystem system;
    private final Address self;
    private final Logger logger;
    private MessageEnvelope<?> current;

    DefaultActorContext(ActorSystem system, Address self) {
        this.system = system;
        this.self = self;
        this.logger = LoggerFactory.getLogger("actor." + self.path());
    }

    void current(MessageEnvelope<?> envelope) {
        this.current = envelope;
    }

    @Override
    public Address self() {
        return self;
    }

    @Override
    public Optional<Address> sender() {
        return current == null ? Optional.empty() : current.sender();
    }

    @Override
    public MessageEnvelope<?> envelope() {
        return current;
    }

    @Override
    public <T> void tell(Address target, T message) {
        system.tell(self, target, message);
    }

    @Override
    public <T> void tellSelf(T message) {
        system.tell(self, self, message);
    }

    @Override
    public <R> boolean reply(Class<R> type, R response) {
        MessageEnvelope<?> request = current;
        if (request == null) {
            throw new IllegalStateException("reply called outside of message processing in " + self);
        }
        if (request.correlationId().isPresent()) {
            return system.messageBus().publishReply(request.reply(self, type, response));
        }
        Optional<Address> sender = request.replyTo().or(request::sender);
        if (sender.isPresent()) {
            system.tell(self, sender.get(), response);
            return true;
        }
        logger.debug("Nobody to reply to for {}", request);
        return false;
    }

    @Override
    public ActorSystem getSystem() {
        return system;
    }

    @Override
    public Logger getLogger() {
        return logger;
    }
}
