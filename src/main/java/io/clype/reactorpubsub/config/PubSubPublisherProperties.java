package io.clype.reactorpubsub.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.clype.reactorpubsub.retry.RetryPolicy;
import io.clype.reactorpubsub.transport.BatchSettings;

/**
 * Configuration properties for the ordered publisher.
 *
 * <p>These properties are bound to the {@code pubsub.publisher} prefix in your
 * application configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * pubsub:
 *   publisher:
 *     topic-arn: arn:aws:sns:us-east-1:123456789012:Orders.fifo
 *     region: us-east-1
 *     max-connections: 100
 *     retry:
 *       initial-delay: 100ms
 *       multiplier: 2.0
 *       max-delay: 5s
 *       max-elapsed-time: 60s
 *       jitter: 0.5
 *     batching:
 *       max-messages: 10
 *       max-delay: 10ms
 *       max-concurrency: 16
 *     metrics:
 *       enabled: true
 * }</pre>
 *
 * @see PubSubPublisherAutoConfiguration
 */
@ConfigurationProperties(prefix = "pubsub.publisher")
public class PubSubPublisherProperties {

    public static final int DEFAULT_MAX_CONNECTIONS = 100;

    private String topicArn;
    private String region;
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private RetryConfig retry = new RetryConfig();
    private BatchingConfig batching = new BatchingConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public String getTopicArn() { return topicArn; }
    public void setTopicArn(String topicArn) { this.topicArn = topicArn; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public BatchingConfig getBatching() { return batching; }
    public void setBatching(BatchingConfig batching) { this.batching = batching; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Dispatch retry configuration. Only transient backend failures are retried.
     */
    public static class RetryConfig {
        private Duration initialDelay = Duration.ofMillis(100);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(5);
        private Duration maxElapsedTime = Duration.ofSeconds(60);
        private double jitter = 0.5;

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public Duration getMaxElapsedTime() { return maxElapsedTime; }
        public void setMaxElapsedTime(Duration maxElapsedTime) { this.maxElapsedTime = maxElapsedTime; }

        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }

        /**
         * @throws IllegalArgumentException if the values do not form a valid policy
         */
        public RetryPolicy toPolicy() {
            return RetryPolicy.forTransientErrors(initialDelay, multiplier, maxElapsedTime)
                    .withMaxDelay(maxDelay)
                    .withJitter(jitter);
        }
    }

    /** Client-side batching configuration for the SNS transport. */
    public static class BatchingConfig {
        private int maxMessages = BatchSettings.MAX_BATCH_SIZE;
        private Duration maxDelay = BatchSettings.DEFAULT_MAX_DELAY;
        private int maxConcurrency = BatchSettings.DEFAULT_MAX_CONCURRENCY;

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public BatchSettings toSettings() {
            return new BatchSettings(maxMessages, maxDelay, maxConcurrency);
        }
    }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
