package io.clype.reactorpubsub.admin;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Topic lifecycle operations against the messaging backend.
 *
 * <p>The backend is eventually consistent: a topic that was just created or deleted may
 * not show up in {@link #listTopics()} right away. Callers that need to observe the
 * change should poll with {@link io.clype.reactorpubsub.retry.EventuallyConsistentRetrier}.</p>
 */
public interface TopicAdmin {

    /**
     * Creates a topic, or returns the existing one with the same name.
     *
     * @param name topic name; names ending in {@code .fifo} create FIFO topics
     * @return the topic ARN and whether it was created by this call
     */
    Mono<TopicCreation> createOrGetTopic(String name);

    /**
     * Lists the ARNs of all topics visible to the client, following pagination.
     */
    Flux<String> listTopics();

    /**
     * Finds a topic by name.
     *
     * @return the topic ARN, or empty if no listed topic has this name
     */
    Mono<String> findTopic(String name);

    Mono<Boolean> topicExists(String name);

    Mono<Void> deleteTopic(String topicArn);

    /**
     * Creates or gets a topic and wraps it in a handle that deletes it on close.
     */
    Mono<ScopedTopic> openScopedTopic(String name);
}
