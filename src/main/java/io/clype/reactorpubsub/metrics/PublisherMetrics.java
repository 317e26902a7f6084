package io.clype.reactorpubsub.metrics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Collects and exposes metrics for ordered publishing.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code pubsub.publisher.messages.published} - Counter of successfully published messages</li>
 *   <li>{@code pubsub.publisher.messages.failed} - Counter of messages whose dispatch failed</li>
 *   <li>{@code pubsub.publisher.messages.poisoned} - Counter of messages rejected on a paused ordering key</li>
 *   <li>{@code pubsub.publisher.dispatch.retries} - Counter of dispatch retries</li>
 *   <li>{@code pubsub.publisher.keys.resumed} - Counter of ordering keys resumed after a pause</li>
 *   <li>{@code pubsub.publisher.publish.latency} - Timer measuring dispatch latency (p50, p95, p99)</li>
 *   <li>{@code pubsub.publisher.requests.active} - Gauge of in-flight dispatches</li>
 * </ul>
 *
 * <p>All metrics are tagged with the topic name for multi-topic environments.</p>
 */
public class PublisherMetrics {

    private static final String METRIC_PREFIX = "pubsub.publisher";
    private static final double[] PUBLISH_LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    private final Counter messagesPublished;
    private final Counter messagesFailed;
    private final Counter messagesPoisoned;
    private final Counter dispatchRetries;
    private final Counter keysResumed;
    private final Timer publishLatency;
    private final AtomicInteger activeRequests;

    /**
     * Creates a new PublisherMetrics instance.
     *
     * @param registry the Micrometer registry to register metrics with
     * @param topicArn the topic ARN (used for tagging metrics)
     */
    public PublisherMetrics(MeterRegistry registry, String topicArn) {
        Tags tags = Tags.of("topic", extractTopicName(topicArn));

        this.messagesPublished = Counter.builder(METRIC_PREFIX + ".messages.published")
                .description("Number of messages successfully published")
                .tags(tags)
                .register(registry);

        this.messagesFailed = Counter.builder(METRIC_PREFIX + ".messages.failed")
                .description("Number of messages whose dispatch failed")
                .tags(tags)
                .register(registry);

        this.messagesPoisoned = Counter.builder(METRIC_PREFIX + ".messages.poisoned")
                .description("Number of messages rejected because their ordering key was paused")
                .tags(tags)
                .register(registry);

        this.dispatchRetries = Counter.builder(METRIC_PREFIX + ".dispatch.retries")
                .description("Number of dispatch retries after transient failures")
                .tags(tags)
                .register(registry);

        this.keysResumed = Counter.builder(METRIC_PREFIX + ".keys.resumed")
                .description("Number of ordering keys resumed after a pause")
                .tags(tags)
                .register(registry);

        this.publishLatency = Timer.builder(METRIC_PREFIX + ".publish.latency")
                .description("Time taken to dispatch a message, retries included")
                .tags(tags)
                .publishPercentiles(PUBLISH_LATENCY_PERCENTILES)
                .register(registry);

        this.activeRequests = new AtomicInteger(0);
        Gauge.builder(METRIC_PREFIX + ".requests.active", activeRequests, AtomicInteger::get)
                .description("Number of in-flight dispatches")
                .tags(tags)
                .register(registry);
    }

    /**
     * Records a successful publication.
     *
     * @param latencyNanos time taken to dispatch in nanoseconds
     */
    public void recordSuccess(long latencyNanos) {
        messagesPublished.increment();
        publishLatency.record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records a dispatch that failed after any retries.
     */
    public void recordFailure() {
        messagesFailed.increment();
    }

    /**
     * Records messages failed without dispatch because their key was paused.
     *
     * @param count number of rejected messages
     */
    public void recordPoisoned(int count) {
        messagesPoisoned.increment(count);
    }

    public void recordRetry() {
        dispatchRetries.increment();
    }

    public void recordResume() {
        keysResumed.increment();
    }

    /**
     * Increments the active requests counter.
     * Call this when starting a dispatch.
     */
    public void incrementActiveRequests() {
        activeRequests.incrementAndGet();
    }

    /**
     * Decrements the active requests counter.
     * Call this when a dispatch completes (success or failure).
     */
    public void decrementActiveRequests() {
        activeRequests.decrementAndGet();
    }

    /**
     * Extracts the topic name from an ARN.
     *
     * @param topicArn the full ARN (e.g., arn:aws:sns:us-east-1:123456789012:MyTopic.fifo)
     * @return the topic name (e.g., MyTopic.fifo)
     */
    private static String extractTopicName(String topicArn) {
        if (topicArn == null || topicArn.isEmpty()) {
            return "unknown";
        }
        int lastColon = topicArn.lastIndexOf(':');
        if (lastColon >= 0 && lastColon < topicArn.length() - 1) {
            return topicArn.substring(lastColon + 1);
        }
        return topicArn;
    }
}
