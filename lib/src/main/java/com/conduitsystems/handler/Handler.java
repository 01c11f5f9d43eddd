package com.conduitsystems.handler;

import com.conduitsystems.ActorContext;

/**
 * Message handling logic of an actor. A fresh handler is built from the actor's factory
 * on every (re)start, so any state it keeps is lost when its supervisor restarts it.
 *
 * @param <Message> The type of messages this handler processes
 */
public interface Handler<Message> {

    /**
     * Processes a message.
     *
     * @param message The message to process
     * @param context The actor context providing access to actor functionality
     */
    void receive(Message message, ActorContext context);

    /**
     * Called before the first message is processed. An exception here fails the
     * actor's start.
     *
     * @param context The actor context providing access to actor functionality
     */
    default void preStart(ActorContext context) {
    }

    /**
     * Called after the actor has stopped processing messages.
     *
     * @param context The actor context providing access to actor functionality
     */
    default void postStop(ActorContext context) {
    }

    /**
     * Called when {@link #receive} throws.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     * @param context   The actor context providing access to actor functionality
     * @return true if the error was dealt with and the actor should go on; false to crash
     *         the actor and let its supervisor decide
     */
    default boolean onError(Message message, Throwable exception, ActorContext context) {
        return false;
    }
}
