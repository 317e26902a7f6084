package io.clype.reactorpubsub.transport;

import java.util.concurrent.CompletableFuture;

import io.clype.reactorpubsub.model.PubSubMessage;

/**
 * Sends single messages to the messaging backend.
 *
 * <p>Implementations are asynchronous and make an at-least-once delivery attempt per call.
 * They do not order messages; ordering is the caller's concern. Failures should be reported
 * as {@link io.clype.reactorpubsub.model.TransientBackendException} or
 * {@link io.clype.reactorpubsub.model.FatalBackendException} so callers can decide whether
 * to retry.</p>
 */
@FunctionalInterface
public interface PublishTransport {

    /**
     * Sends a message.
     *
     * @param message the message to send
     * @return a future completed with the backend message id, or exceptionally on failure
     */
    CompletableFuture<String> send(PubSubMessage message);
}
