package io.clype.reactorpubsub.admin;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import io.clype.reactorpubsub.transport.SnsErrorClassifier;
import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.CreateTopicRequest;
import software.amazon.awssdk.services.sns.model.DeleteTopicRequest;
import software.amazon.awssdk.services.sns.model.ListTopicsRequest;
import software.amazon.awssdk.services.sns.model.ListTopicsResponse;
import software.amazon.awssdk.services.sns.model.Topic;

/**
 * {@link TopicAdmin} backed by the AWS SNS async client.
 *
 * <p>SDK failures are mapped through {@link SnsErrorClassifier}, so callers see
 * {@link io.clype.reactorpubsub.model.TransientBackendException} or
 * {@link io.clype.reactorpubsub.model.FatalBackendException}.</p>
 */
public class SnsTopicAdmin implements TopicAdmin {

    private static final Logger log = LoggerFactory.getLogger(SnsTopicAdmin.class);

    private static final String FIFO_SUFFIX = ".fifo";

    /** SNS topic names: 1 to 256 alphanumerics, hyphens and underscores, plus {@code .fifo}. */
    private static final Pattern TOPIC_NAME = Pattern.compile("[A-Za-z0-9_-]{1,251}(\\.fifo)?|[A-Za-z0-9_-]{1,256}");

    private final SnsAsyncClient snsClient;

    public SnsTopicAdmin(SnsAsyncClient snsClient) {
        this.snsClient = Objects.requireNonNull(snsClient, "snsClient cannot be null");
    }

    /**
     * Looks the name up first and only calls CreateTopic when it is not listed. Two
     * concurrent callers may both see {@code CREATED}; SNS CreateTopic is idempotent, so
     * both get the same ARN.
     */
    @Override
    public Mono<TopicCreation> createOrGetTopic(String name) {
        validateName(name);
        return findTopic(name)
                .map(arn -> new TopicCreation(arn, TopicCreation.Outcome.ALREADY_EXISTS))
                .switchIfEmpty(Mono.defer(() -> createTopic(name)))
                .doOnNext(creation -> log.info("Topic {} {}",
                        LogSanitizer.sanitize(creation.topicArn()),
                        creation.created() ? "created" : "already exists"));
    }

    @Override
    public Flux<String> listTopics() {
        return listPage(null)
                .expand(response -> response.nextToken() == null
                        ? Mono.empty()
                        : listPage(response.nextToken()))
                .flatMapIterable(ListTopicsResponse::topics)
                .map(Topic::topicArn);
    }

    @Override
    public Mono<String> findTopic(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return listTopics()
                .filter(arn -> name.equals(topicName(arn)))
                .next();
    }

    @Override
    public Mono<Boolean> topicExists(String name) {
        return findTopic(name).hasElement();
    }

    @Override
    public Mono<Void> deleteTopic(String topicArn) {
        Objects.requireNonNull(topicArn, "topicArn cannot be null");
        return Mono.fromFuture(() -> snsClient.deleteTopic(DeleteTopicRequest.builder()
                        .topicArn(topicArn)
                        .build()))
                .onErrorMap(SnsErrorClassifier::classify)
                .doOnSuccess(response -> log.info("Deleted topic {}", LogSanitizer.sanitize(topicArn)))
                .then();
    }

    @Override
    public Mono<ScopedTopic> openScopedTopic(String name) {
        return createOrGetTopic(name).map(creation -> new ScopedTopic(this, creation));
    }

    /**
     * Returns the topic name part of an ARN ({@code arn:aws:sns:region:account:name}).
     */
    static String topicName(String topicArn) {
        if (topicArn == null) {
            return null;
        }
        int idx = topicArn.lastIndexOf(':');
        return idx >= 0 ? topicArn.substring(idx + 1) : topicArn;
    }

    private Mono<TopicCreation> createTopic(String name) {
        CreateTopicRequest.Builder request = CreateTopicRequest.builder().name(name);
        if (name.endsWith(FIFO_SUFFIX)) {
            request.attributes(Map.of("FifoTopic", "true"));
        }
        CreateTopicRequest built = request.build();
        return Mono.fromFuture(() -> snsClient.createTopic(built))
                .onErrorMap(SnsErrorClassifier::classify)
                .map(response -> new TopicCreation(response.topicArn(), TopicCreation.Outcome.CREATED));
    }

    private Mono<ListTopicsResponse> listPage(String nextToken) {
        ListTopicsRequest request = ListTopicsRequest.builder()
                .nextToken(nextToken)
                .build();
        return Mono.fromFuture(() -> snsClient.listTopics(request))
                .onErrorMap(SnsErrorClassifier::classify);
    }

    private static void validateName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        Preconditions.checkArgument(TOPIC_NAME.matcher(name).matches(),
                "Invalid topic name '%s': use 1 to 256 letters, digits, hyphens or underscores, "
                        + "optionally ending in .fifo", LogSanitizer.sanitize(name));
    }
}
