package io.clype.reactorpubsub.admin;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorpubsub.util.LogSanitizer;

/**
 * Handle to a topic that is deleted when the handle is closed.
 *
 * <pre>{@code
 * try (ScopedTopic topic = admin.openScopedTopic("orders-test").block()) {
 *     publish(topic.topicArn());
 * }
 * }</pre>
 *
 * <p>{@link #close()} blocks until the delete call returns and is idempotent.</p>
 */
public final class ScopedTopic implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScopedTopic.class);

    static final Duration DELETE_TIMEOUT = Duration.ofSeconds(30);

    private final TopicAdmin admin;
    private final TopicCreation creation;
    private final AtomicBoolean closed = new AtomicBoolean();

    ScopedTopic(TopicAdmin admin, TopicCreation creation) {
        this.admin = Objects.requireNonNull(admin, "admin cannot be null");
        this.creation = Objects.requireNonNull(creation, "creation cannot be null");
    }

    public String topicArn() {
        return creation.topicArn();
    }

    public TopicCreation creation() {
        return creation;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("Deleting scoped topic {}", LogSanitizer.sanitize(creation.topicArn()));
        admin.deleteTopic(creation.topicArn()).block(DELETE_TIMEOUT);
    }
}
