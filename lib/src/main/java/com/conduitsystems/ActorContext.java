package com.conduitsystems;

import com.conduitsystems.address.Address;
import com.conduitsystems.message.MessageEnvelope;
import org.slf4j.Logger;

import java.util.Optional;

/**
 * Provides a restricted view of actor functionality to handlers.
 * This allows handlers to access necessary actor features without exposing internal implementation details.
 */
public interface ActorContext {

    /**
     * Gets the address of this actor.
     *
     * @return The address this actor is registered under
     */
    Address self();

    /**
     * Gets the sender of the message being processed, if the sender gave one.
     *
     * @return An Optional containing the sender's address, or empty
     */
    Optional<Address> sender();

    /**
     * Gets the envelope of the message being processed, with its correlation id, TTL and
     * priority.
     *
     * @return The current envelope, or null outside of {@code receive}
     */
    MessageEnvelope<?> envelope();

    /**
     * Sends a message to another actor, with this actor as the sender.
     *
     * @param <T> The type of the message
     * @param target The target actor's address
     * @param message The message to send
     */
    <T> void tell(Address target, T message);

    /**
     * Sends a message to this actor.
     *
     * @param <T> The type of the message
     * @param message The message to send
     */
    <T> void tellSelf(T message);

    /**
     * Answers the message being processed. A request issued with {@code ask} is completed
     * with the value; a plain message with a sender gets the value as a new message.
     *
     * @param <R> The type of the response
     * @param type The type the requester expects
     * @param response The response to send
     * @return true if the response reached a requester or was sent to the sender
     */
    <R> boolean reply(Class<R> type, R response);

    /**
     * Gets the actor system this actor belongs to.
     *
     * @return The actor system
     */
    ActorSystem getSystem();

    /**
     * Gets a logger for this actor with the actor address as context.
     *
     * @return A logger instance configured for this actor
     */
    Logger getLogger();
}
