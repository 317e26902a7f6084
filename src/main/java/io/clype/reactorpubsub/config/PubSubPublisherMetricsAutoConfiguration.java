package io.clype.reactorpubsub.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for publisher metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>The {@code pubsub.publisher.topic-arn} property is set</li>
 *   <li>The {@code pubsub.publisher.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * <p>It runs before {@link PubSubPublisherAutoConfiguration} so the publisher picks the
 * metrics bean up.</p>
 *
 * @see PublisherMetrics
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "pubsub.publisher.metrics", name = "enabled",
        havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PubSubPublisherProperties.class)
public class PubSubPublisherMetricsAutoConfiguration {

    /**
     * Creates the publisher metrics bean.
     *
     * @param registry   the Micrometer meter registry
     * @param properties the publisher configuration properties
     * @return the configured metrics instance
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pubsub.publisher", name = "topic-arn")
    public PublisherMetrics publisherMetrics(
            MeterRegistry registry,
            PubSubPublisherProperties properties) {
        return new PublisherMetrics(registry, properties.getTopicArn());
    }
}
