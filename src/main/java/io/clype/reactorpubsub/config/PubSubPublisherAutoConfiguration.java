package io.clype.reactorpubsub.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.reactorpubsub.admin.SnsTopicAdmin;
import io.clype.reactorpubsub.admin.TopicAdmin;
import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.retry.EventuallyConsistentRetrier;
import io.clype.reactorpubsub.service.OrderedPublisher;
import io.clype.reactorpubsub.transport.PublishTransport;
import io.clype.reactorpubsub.transport.SnsPublishTransport;

import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.crt.AwsCrtAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsAsyncClient;

/**
 * Spring Boot auto-configuration for the ordered publisher.
 *
 * <p>This configuration is automatically enabled when the {@code pubsub.publisher.topic-arn}
 * property is set in your application configuration.</p>
 *
 * <p><b>Configuration Example (application.yml):</b></p>
 * <pre>{@code
 * pubsub:
 *   publisher:
 *     topic-arn: arn:aws:sns:us-east-1:123456789012:Orders.fifo
 *     region: us-east-1        # Optional, uses default provider chain if not set
 *     max-connections: 100     # Optional, default: 100
 * }</pre>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}, allowing you to provide your own implementations
 * by defining beans of the same type in your application configuration. Supplying a
 * {@link PublishTransport} bean replaces the SNS transport.</p>
 *
 * <p><b>AWS Credentials:</b> The SNS client uses the default AWS credential provider chain.</p>
 *
 * @see PubSubPublisherProperties
 * @see OrderedPublisher
 */
@AutoConfiguration(after = PubSubPublisherMetricsAutoConfiguration.class)
@EnableConfigurationProperties(PubSubPublisherProperties.class)
@ConditionalOnProperty(prefix = "pubsub.publisher", name = "topic-arn")
public class PubSubPublisherAutoConfiguration {

    private final PubSubPublisherProperties properties;

    public PubSubPublisherAutoConfiguration(PubSubPublisherProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an AWS CRT-based async HTTP client shared by the SNS client.
     *
     * @return the configured async HTTP client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SdkAsyncHttpClient awsCrtHttpClient() {
        return AwsCrtAsyncHttpClient.builder()
                .maxConcurrency(properties.getMaxConnections())
                .connectionTimeout(Duration.ofSeconds(10))
                .connectionMaxIdleTime(Duration.ofSeconds(60))
                .build();
    }

    /**
     * Creates the AWS SNS async client. Without a configured region the default AWS region
     * provider chain is used.
     *
     * @param httpClient the async HTTP client to use for API calls
     * @return the configured SNS async client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SnsAsyncClient snsAsyncClient(SdkAsyncHttpClient httpClient) {
        var builder = SnsAsyncClient.builder()
                .httpClient(httpClient);

        if (properties.getRegion() != null && !properties.getRegion().isEmpty()) {
            builder.region(Region.of(properties.getRegion()));
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SnsAsyncClient.class)
    public TopicAdmin snsTopicAdmin(SnsAsyncClient snsClient) {
        return new SnsTopicAdmin(snsClient);
    }

    /**
     * Creates the batching SNS transport for the configured topic.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SnsAsyncClient.class)
    public PublishTransport snsPublishTransport(SnsAsyncClient snsClient) {
        return new SnsPublishTransport(snsClient, properties.getTopicArn(), properties.getBatching().toSettings());
    }

    /**
     * Creates the ordered publisher bean.
     *
     * @param transport the transport messages are sent through
     * @param metrics   optional metrics collector (may be null if metrics are disabled)
     * @return the configured publisher instance
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PublishTransport.class)
    public OrderedPublisher orderedPublisher(
            PublishTransport transport,
            @Autowired(required = false) PublisherMetrics metrics) {
        return new OrderedPublisher(transport, properties.getRetry().toPolicy(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventuallyConsistentRetrier eventuallyConsistentRetrier() {
        return EventuallyConsistentRetrier.system();
    }
}
