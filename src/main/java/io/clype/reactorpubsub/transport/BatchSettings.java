package io.clype.reactorpubsub.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Client-side batching settings for {@link SnsPublishTransport}.
 *
 * <p>A batch is sent as soon as {@code maxMessages} sends are buffered or {@code maxDelay}
 * has passed since the first buffered send, whichever comes first.</p>
 *
 * @param maxMessages    messages per PublishBatch call (1 to 10, SNS limit)
 * @param maxDelay       longest time a send waits for its batch to fill
 * @param maxConcurrency number of PublishBatch calls in flight at once
 */
public record BatchSettings(
    int maxMessages,
    Duration maxDelay,
    int maxConcurrency
) {
    /** SNS maximum messages per PublishBatch API call (AWS hard limit). */
    public static final int MAX_BATCH_SIZE = 10;

    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(10);

    public static final int DEFAULT_MAX_CONCURRENCY = 16;

    public BatchSettings {
        Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
        if (maxMessages <= 0 || maxMessages > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("maxMessages must be between 1 and " + MAX_BATCH_SIZE);
        }
        if (maxDelay.isZero() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be positive");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
    }

    public static BatchSettings defaults() {
        return new BatchSettings(MAX_BATCH_SIZE, DEFAULT_MAX_DELAY, DEFAULT_MAX_CONCURRENCY);
    }

    /**
     * Settings that send every message on its own.
     */
    public static BatchSettings unbatched() {
        return new BatchSettings(1, Duration.ofMillis(1), DEFAULT_MAX_CONCURRENCY);
    }
}
