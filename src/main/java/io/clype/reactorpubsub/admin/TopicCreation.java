package io.clype.reactorpubsub.admin;

import java.util.Objects;

/**
 * Result of {@link TopicAdmin#createOrGetTopic(String)}.
 *
 * @param topicArn the topic's ARN
 * @param outcome  whether the topic was created or already existed
 */
public record TopicCreation(String topicArn, Outcome outcome) {

    public enum Outcome {
        CREATED,
        ALREADY_EXISTS
    }

    public TopicCreation {
        Objects.requireNonNull(topicArn, "topicArn cannot be null");
        Objects.requireNonNull(outcome, "outcome cannot be null");
    }

    public boolean created() {
        return outcome == Outcome.CREATED;
    }
}
