package com.conduitsystems.bus;

import com.conduitsystems.message.MessageEnvelope;
import com.conduitsystems.message.ReplyTypeMismatchException;
import com.conduitsystems.message.TypedReply;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * An outstanding request waiting for its reply.
 *
 * @param correlationId links the request to its reply
 * @param replyType the payload type the requester expects
 * @param future completed with the reply, or with empty on timeout
 * @param createdAt when the request was issued
 * @param deadline when the request times out
 */
record PendingRequest<R>(
        UUID correlationId,
        Class<R> replyType,
        CompletableFuture<Optional<MessageEnvelope<R>>> future,
        Instant createdAt,
        Instant deadline) {

    /**
     * Completes the request with the reply, unwrapping a {@link TypedReply} after checking
     * its tag. A payload of the wrong type fails the request instead.
     */
    void complete(MessageEnvelope<?> reply) {
        Object payload = reply.payload();
        R value;
        try {
            if (payload instanceof TypedReply<?> typed) {
                value = typed.unwrap(replyType);
            } else if (replyType.isInstance(payload)) {
                value = replyType.cast(payload);
            } else {
                throw new ReplyTypeMismatchException(replyType, payload.getClass());
            }
        } catch (ReplyTypeMismatchException e) {
            future.completeExceptionally(e);
            return;
        }
        future.complete(Optional.of(reply.withPayload(value)));
    }

    void expire() {
        future.complete(Optional.empty());
    }
}
