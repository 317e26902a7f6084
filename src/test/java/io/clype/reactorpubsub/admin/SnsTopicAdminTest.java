package io.clype.reactorpubsub.admin;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.clype.reactorpubsub.model.TransientBackendException;

import reactor.test.StepVerifier;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.CreateTopicRequest;
import software.amazon.awssdk.services.sns.model.CreateTopicResponse;
import software.amazon.awssdk.services.sns.model.DeleteTopicRequest;
import software.amazon.awssdk.services.sns.model.DeleteTopicResponse;
import software.amazon.awssdk.services.sns.model.ListTopicsRequest;
import software.amazon.awssdk.services.sns.model.ListTopicsResponse;
import software.amazon.awssdk.services.sns.model.SnsException;
import software.amazon.awssdk.services.sns.model.Topic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SnsTopicAdminTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String PREFIX = "arn:aws:sns:us-east-1:123456789012:";

    private SnsAsyncClient snsClient;
    private SnsTopicAdmin admin;

    @BeforeEach
    void setUp() {
        snsClient = mock(SnsAsyncClient.class);
        admin = new SnsTopicAdmin(snsClient);

        // two pages: the second one is only reachable through the NextToken
        when(snsClient.listTopics(any(ListTopicsRequest.class)))
            .thenAnswer(invocation -> {
                ListTopicsRequest request = invocation.getArgument(0);
                if (request.nextToken() == null) {
                    return CompletableFuture.completedFuture(ListTopicsResponse.builder()
                        .topics(topic("alpha"), topic("beta"))
                        .nextToken("page-2")
                        .build());
                }
                return CompletableFuture.completedFuture(ListTopicsResponse.builder()
                    .topics(topic("orders.fifo"))
                    .build());
            });
        when(snsClient.deleteTopic(any(DeleteTopicRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(DeleteTopicResponse.builder().build()));
    }

    @Test
    void testListTopicsFollowsPagination() {
        StepVerifier.create(admin.listTopics())
                .expectNext(PREFIX + "alpha", PREFIX + "beta", PREFIX + "orders.fifo")
                .verifyComplete();

        verify(snsClient, times(2)).listTopics(any(ListTopicsRequest.class));
    }

    @Test
    void testFindTopicByName() {
        StepVerifier.create(admin.findTopic("orders.fifo"))
                .expectNext(PREFIX + "orders.fifo")
                .verifyComplete();
        StepVerifier.create(admin.findTopic("orders"))
                .verifyComplete();
    }

    @Test
    void testTopicExists() {
        StepVerifier.create(admin.topicExists("beta")).expectNext(true).verifyComplete();
        StepVerifier.create(admin.topicExists("gamma")).expectNext(false).verifyComplete();
    }

    @Test
    void testExistingTopicIsNotRecreated() {
        StepVerifier.create(admin.createOrGetTopic("alpha"))
                .expectNext(new TopicCreation(PREFIX + "alpha", TopicCreation.Outcome.ALREADY_EXISTS))
                .verifyComplete();

        verify(snsClient, never()).createTopic(any(CreateTopicRequest.class));
    }

    @Test
    void testMissingTopicIsCreated() {
        mockCreateTopic();

        StepVerifier.create(admin.createOrGetTopic("payments"))
                .assertNext(creation -> {
                    assertThat(creation.topicArn()).isEqualTo(PREFIX + "payments");
                    assertThat(creation.created()).isTrue();
                })
                .verifyComplete();

        ArgumentCaptor<CreateTopicRequest> captor = ArgumentCaptor.forClass(CreateTopicRequest.class);
        verify(snsClient).createTopic(captor.capture());
        assertThat(captor.getValue().name()).isEqualTo("payments");
        assertThat(captor.getValue().attributes()).doesNotContainKey("FifoTopic");
    }

    @Test
    void testFifoNameCreatesFifoTopic() {
        mockCreateTopic();

        StepVerifier.create(admin.createOrGetTopic("payments.fifo"))
                .expectNextMatches(TopicCreation::created)
                .verifyComplete();

        ArgumentCaptor<CreateTopicRequest> captor = ArgumentCaptor.forClass(CreateTopicRequest.class);
        verify(snsClient).createTopic(captor.capture());
        assertThat(captor.getValue().attributes()).containsEntry("FifoTopic", "true");
    }

    @Test
    void testInvalidTopicNameIsRejected() {
        assertThatThrownBy(() -> admin.createOrGetTopic("bad name"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> admin.createOrGetTopic("a".repeat(257)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> admin.createOrGetTopic(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testDeleteTopic() {
        StepVerifier.create(admin.deleteTopic(PREFIX + "alpha")).verifyComplete();

        ArgumentCaptor<DeleteTopicRequest> captor = ArgumentCaptor.forClass(DeleteTopicRequest.class);
        verify(snsClient).deleteTopic(captor.capture());
        assertThat(captor.getValue().topicArn()).isEqualTo(PREFIX + "alpha");
    }

    @Test
    void testScopedTopicIsDeletedOnceOnClose() {
        mockCreateTopic();

        ScopedTopic scoped = admin.openScopedTopic("scratch").block(TIMEOUT);
        assertThat(scoped.topicArn()).isEqualTo(PREFIX + "scratch");
        assertThat(scoped.isClosed()).isFalse();

        scoped.close();
        scoped.close();

        assertThat(scoped.isClosed()).isTrue();
        verify(snsClient, times(1)).deleteTopic(any(DeleteTopicRequest.class));
    }

    @Test
    void testThrottledListingIsTransient() {
        when(snsClient.listTopics(any(ListTopicsRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(SnsException.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("Throttling").build())
                .message("Rate exceeded")
                .statusCode(400)
                .build()));

        StepVerifier.create(admin.topicExists("alpha"))
                .expectError(TransientBackendException.class)
                .verify(TIMEOUT);
    }

    @Test
    void testTopicNameFromArn() {
        assertThat(SnsTopicAdmin.topicName(PREFIX + "orders.fifo")).isEqualTo("orders.fifo");
        assertThat(SnsTopicAdmin.topicName("plain")).isEqualTo("plain");
    }

    private void mockCreateTopic() {
        when(snsClient.createTopic(any(CreateTopicRequest.class)))
            .thenAnswer(invocation -> {
                CreateTopicRequest request = invocation.getArgument(0);
                return CompletableFuture.completedFuture(CreateTopicResponse.builder()
                    .topicArn(PREFIX + request.name())
                    .build());
            });
    }

    private static Topic topic(String name) {
        return Topic.builder().topicArn(PREFIX + name).build();
    }
}
