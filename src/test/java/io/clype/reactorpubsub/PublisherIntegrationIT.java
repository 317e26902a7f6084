package io.clype.reactorpubsub;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import io.clype.reactorpubsub.admin.ScopedTopic;
import io.clype.reactorpubsub.admin.SnsTopicAdmin;
import io.clype.reactorpubsub.admin.TopicCreation;
import io.clype.reactorpubsub.model.PubSubMessage;
import io.clype.reactorpubsub.model.PublishResult;
import io.clype.reactorpubsub.retry.EventuallyConsistentRetrier;
import io.clype.reactorpubsub.retry.RetryPolicy;
import io.clype.reactorpubsub.service.OrderedPublisher;
import io.clype.reactorpubsub.transport.BatchSettings;
import io.clype.reactorpubsub.transport.SnsPublishTransport;

import reactor.core.publisher.Mono;

import software.amazon.awssdk.services.sns.SnsAsyncClient;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against a real SNS endpoint with the default AWS credential and region chains.
 * Enable with {@code PUBSUB_IT_ENABLED=true}; failsafe runs it during {@code mvn verify}
 * or from the IDE.
 */
@EnabledIfEnvironmentVariable(named = "PUBSUB_IT_ENABLED", matches = "true")
class PublisherIntegrationIT {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final RetryPolicy VISIBILITY =
            RetryPolicy.forAssertions(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));

    private static SnsAsyncClient snsClient;
    private static SnsTopicAdmin admin;
    private static EventuallyConsistentRetrier retrier;

    @BeforeAll
    static void setUp() {
        snsClient = SnsAsyncClient.create();
        admin = new SnsTopicAdmin(snsClient);
        retrier = EventuallyConsistentRetrier.system();
    }

    @AfterAll
    static void tearDown() {
        snsClient.close();
    }

    @Test
    void createdTopicBecomesVisibleAndDeletedTopicDisappears() {
        String name = uniqueName("it-lifecycle");
        TopicCreation creation = admin.createOrGetTopic(name).block(TIMEOUT);
        assertThat(creation.created()).isTrue();

        retrier.retry("topic listed", () -> assertThat(admin.listTopics().collectList().block(TIMEOUT))
                .contains(creation.topicArn()), VISIBILITY);
        assertThat(admin.createOrGetTopic(name).block(TIMEOUT).outcome())
                .isEqualTo(TopicCreation.Outcome.ALREADY_EXISTS);

        admin.deleteTopic(creation.topicArn()).block(TIMEOUT);
        retrier.retry("topic gone", () -> assertThat(admin.topicExists(name).block(TIMEOUT)).isFalse(), VISIBILITY);
    }

    @Test
    void publishPlainAndWithAttributes() {
        try (ScopedTopic topic = admin.openScopedTopic(uniqueName("it-plain")).block(TIMEOUT);
             SnsPublishTransport transport = new SnsPublishTransport(snsClient, topic.topicArn())) {
            OrderedPublisher publisher = new OrderedPublisher(transport);

            assertThat(publisher.publish(PubSubMessage.of("hello")).block(TIMEOUT).isSuccess()).isTrue();
            assertThat(publisher.publish(new PubSubMessage("with attributes", Map.of("origin", "it"), null))
                    .block(TIMEOUT).isSuccess()).isTrue();
            publisher.destroy();
        }
    }

    @Test
    void publishWithBatchAndRetrySettings() {
        RetryPolicy dispatch = RetryPolicy.forTransientErrors(Duration.ofMillis(200), 1.5, Duration.ofSeconds(20));
        try (ScopedTopic topic = admin.openScopedTopic(uniqueName("it-batch")).block(TIMEOUT);
             SnsPublishTransport transport = new SnsPublishTransport(snsClient, topic.topicArn(),
                     new BatchSettings(5, Duration.ofMillis(50), 4))) {
            OrderedPublisher publisher = new OrderedPublisher(transport, dispatch, null);

            List<Mono<PublishResult>> results = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                results.add(publisher.publish(PubSubMessage.of("batch-" + i)));
            }
            assertThat(publisher.flush(TIMEOUT)).isTrue();
            for (Mono<PublishResult> result : results) {
                assertThat(result.block(TIMEOUT).isSuccess()).isTrue();
            }
            publisher.destroy();
        }
    }

    @Test
    void publishWithErrorHandler() {
        try (ScopedTopic topic = admin.openScopedTopic(uniqueName("it-handler")).block(TIMEOUT);
             SnsPublishTransport transport = new SnsPublishTransport(snsClient, topic.topicArn())) {
            OrderedPublisher publisher = new OrderedPublisher(transport);
            AtomicReference<Throwable> handled = new AtomicReference<>();

            publisher.publish(PubSubMessage.of("handled"))
                    .doOnNext(result -> {
                        if (result instanceof PublishResult.Failure failure) {
                            handled.set(failure.error());
                        }
                    })
                    .block(TIMEOUT);

            assertThat(handled.get()).isNull();
            publisher.destroy();
        }
    }

    @Test
    void publishWithOrderingKeys() {
        try (ScopedTopic topic = admin.openScopedTopic(uniqueName("it-ordered") + ".fifo").block(TIMEOUT);
             SnsPublishTransport transport = new SnsPublishTransport(snsClient, topic.topicArn())) {
            OrderedPublisher publisher = new OrderedPublisher(transport);

            List<Mono<PublishResult>> results = new ArrayList<>();
            for (String key : List.of("key-a", "key-b")) {
                for (int i = 0; i < 3; i++) {
                    results.add(publisher.publish(PubSubMessage.ordered(key, key + "-" + i)));
                }
            }
            for (Mono<PublishResult> result : results) {
                assertThat(result.block(TIMEOUT).isSuccess()).isTrue();
            }
            publisher.destroy();
        }
    }

    private static String uniqueName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
