package com.conduitsystems.bus;

import com.conduitsystems.message.MessageEnvelope;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Publish/subscribe transport with request-reply correlation. The bus knows nothing
 * about individual actors: it broadcasts every envelope to all subscribers, and a
 * router subscription does the per-recipient delivery.
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Broadcasts the envelope to every open subscriber. A closed subscriber neither
     * blocks nor fails delivery to the others.
     *
     * @return the number of subscribers that received the envelope
     * @throws RouteConfigurationException if the envelope has no recipient
     * @throws BusClosedException if the bus has been closed
     */
    int publish(MessageEnvelope<?> envelope);

    /**
     * Registers a new independent consumer of all envelopes published from now on.
     */
    Subscription subscribe();

    /**
     * Publishes the envelope under a fresh correlation id and waits for the matching
     * reply. Times out with an empty result, not an error. The pending entry is removed
     * in every outcome.
     *
     * @param replyType the payload type the reply must carry
     * @return completes with the reply, or empty if none arrived within {@code timeout}
     * @throws RouteConfigurationException if the envelope has no recipient
     */
    <R> CompletableFuture<Optional<MessageEnvelope<R>>> publishRequest(MessageEnvelope<?> envelope,
                                                                      Duration timeout, Class<R> replyType);

    /**
     * Blocking form of {@link #publishRequest}.
     */
    default <R> Optional<MessageEnvelope<R>> request(MessageEnvelope<?> envelope, Duration timeout,
                                                     Class<R> replyType) {
        try {
            return publishRequest(envelope, timeout, replyType).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        } catch (CancellationException e) {
            return Optional.empty();
        }
    }

    /**
     * Resolves the pending request the reply is correlated with.
     *
     * @return true if a waiting request received it, false if it was late, a duplicate
     *         or uncorrelated (the reply is then discarded)
     */
    boolean publishReply(MessageEnvelope<?> reply);

    int pendingRequestCount();

    int subscriberCount();

    boolean isClosed();

    /**
     * Closes all subscriptions and completes outstanding requests with empty.
     */
    @Override
    void close();
}
