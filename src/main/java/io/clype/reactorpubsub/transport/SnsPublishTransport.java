package io.clype.reactorpubsub.transport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.reactorpubsub.model.FatalBackendException;
import io.clype.reactorpubsub.model.PubSubMessage;
import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishBatchRequest;
import software.amazon.awssdk.services.sns.model.PublishBatchRequestEntry;
import software.amazon.awssdk.services.sns.model.PublishBatchResponse;
import software.amazon.awssdk.services.sns.model.PublishBatchResultEntry;

/**
 * {@link PublishTransport} for AWS SNS topics with client-side batching.
 *
 * <p>Sends are buffered and flushed as {@code PublishBatch} calls according to
 * {@link BatchSettings}; each message's future is completed individually from the batch
 * response, so one bad entry does not fail its neighbours.</p>
 *
 * <p><b>FIFO topics:</b> when the topic ARN ends with {@code .fifo}, the ordering key is
 * sent as the {@code MessageGroupId} (unordered messages get a random group) and the
 * message's deduplication id as the {@code MessageDeduplicationId}, so resends of one
 * message are deduplicated by SNS. Ordering keys outside the characters SNS accepts for a
 * group id fail with {@link FatalBackendException} before any request is made. On standard
 * topics neither is sent; ordering of attempts is still enforced by the publisher.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.</p>
 */
public class SnsPublishTransport implements PublishTransport, AutoCloseable, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SnsPublishTransport.class);

    /** SNS maximum payload size per batch: 256 KB (AWS hard limit). */
    public static final int MAX_PAYLOAD_SIZE_BYTES = 256 * 1024;

    private static final String FIFO_SUFFIX = ".fifo";
    private static final String STRING_DATA_TYPE = "String";

    /** Characters SNS accepts in a FIFO message group id or deduplication id. */
    private static final Pattern FIFO_ID_PATTERN = Pattern.compile("[\\p{Alnum}\\p{Punct}]{1,128}");

    private static final String INVALID_PARAMETER = "InvalidParameter";

    private final SnsAsyncClient snsClient;
    private final String topicArn;
    private final boolean fifoTopic;
    private final Sinks.Many<PendingSend> sends = Sinks.many().unicast().onBackpressureBuffer();
    private final Object emitLock = new Object();

    public SnsPublishTransport(SnsAsyncClient snsClient, String topicArn) {
        this(snsClient, topicArn, BatchSettings.defaults());
    }

    /**
     * @param snsClient     the AWS SNS async client to use for publishing
     * @param topicArn      the ARN of the target topic
     * @param batchSettings how sends are grouped into PublishBatch calls
     * @throws NullPointerException if any argument is null
     */
    public SnsPublishTransport(SnsAsyncClient snsClient, String topicArn, BatchSettings batchSettings) {
        this.snsClient = Objects.requireNonNull(snsClient, "snsClient cannot be null");
        this.topicArn = Objects.requireNonNull(topicArn, "topicArn cannot be null");
        Objects.requireNonNull(batchSettings, "batchSettings cannot be null");
        this.fifoTopic = topicArn.endsWith(FIFO_SUFFIX);

        sends.asFlux()
                .bufferTimeout(batchSettings.maxMessages(), batchSettings.maxDelay())
                .flatMapIterable(this::splitByPayloadSize)
                .flatMap(this::publishBatch, batchSettings.maxConcurrency())
                .subscribe(
                        ignored -> { },
                        e -> log.error("Publish pipeline for {} terminated unexpectedly",
                                LogSanitizer.sanitize(topicArn), e));
    }

    @Override
    public CompletableFuture<String> send(PubSubMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        CompletableFuture<String> future = new CompletableFuture<>();

        if (fifoTopic && message.hasOrderingKey() && !FIFO_ID_PATTERN.matcher(message.orderingKey()).matches()) {
            future.completeExceptionally(new FatalBackendException(INVALID_PARAMETER,
                    "Ordering key '" + LogSanitizer.sanitize(message.orderingKey())
                            + "' is not a valid message group id for " + topicArn));
            return future;
        }
        if (fifoTopic && message.deduplicationId() != null
                && !FIFO_ID_PATTERN.matcher(message.deduplicationId()).matches()) {
            future.completeExceptionally(new FatalBackendException(INVALID_PARAMETER,
                    "Deduplication id is not valid for " + topicArn));
            return future;
        }

        // unicast sinks reject concurrent emissions, so serialize them
        Sinks.EmitResult result;
        synchronized (emitLock) {
            result = sends.tryEmitNext(new PendingSend(message, future));
        }
        if (result.isFailure()) {
            future.completeExceptionally(new FatalBackendException(null,
                    "Transport for " + topicArn + " is closed (" + result + ")"));
        }
        return future;
    }

    public String getTopicArn() {
        return topicArn;
    }

    /**
     * Stops accepting sends. Buffered sends are still published.
     */
    @Override
    public void close() {
        synchronized (emitLock) {
            sends.tryEmitComplete();
        }
    }

    @Override
    public void destroy() {
        close();
    }

    // ==========================================================================
    // Batch Publishing
    // ==========================================================================

    /**
     * Splits a batch into smaller sub-batches if the total payload exceeds 256KB.
     * A single oversized message is passed through and rejected by SNS.
     */
    private List<List<PendingSend>> splitByPayloadSize(List<PendingSend> batch) {
        List<List<PendingSend>> result = new ArrayList<>();
        List<PendingSend> currentSubBatch = new ArrayList<>();
        int currentSize = 0;

        for (PendingSend send : batch) {
            int messageSize = estimateSize(send.message());

            if (!currentSubBatch.isEmpty() && (currentSize + messageSize > MAX_PAYLOAD_SIZE_BYTES)) {
                result.add(currentSubBatch);
                currentSubBatch = new ArrayList<>();
                currentSize = 0;
            }

            currentSubBatch.add(send);
            currentSize += messageSize;
        }

        if (!currentSubBatch.isEmpty()) {
            result.add(currentSubBatch);
        }

        return result;
    }

    /**
     * Publishes one batch and completes every future in it. Never signals an error so the
     * pipeline outlives failed batches.
     */
    private Mono<Void> publishBatch(List<PendingSend> batch) {
        return Mono.defer(() -> {
                    PublishBatchRequest request = buildBatchRequest(batch);
                    return Mono.fromFuture(() -> snsClient.publishBatch(request));
                })
                .doOnNext(response -> handleBatchResponse(response, batch))
                .then()
                .onErrorResume(e -> {
                    log.error("Failed to publish batch of {} messages to {}: {}",
                            batch.size(), LogSanitizer.sanitize(topicArn), LogSanitizer.sanitize(e.getMessage()));
                    RuntimeException classified = SnsErrorClassifier.classify(e);
                    batch.forEach(send -> send.future().completeExceptionally(classified));
                    return Mono.empty();
                });
    }

    /**
     * Builds the PublishBatchRequest; entry ids are the positions within the batch.
     */
    private PublishBatchRequest buildBatchRequest(List<PendingSend> batch) {
        List<PublishBatchRequestEntry> entries = new ArrayList<>(batch.size());

        for (int i = 0; i < batch.size(); i++) {
            PubSubMessage message = batch.get(i).message();
            PublishBatchRequestEntry.Builder entry = PublishBatchRequestEntry.builder()
                    .id(String.valueOf(i))
                    .message(message.payload());

            if (!message.attributes().isEmpty()) {
                entry.messageAttributes(toMessageAttributes(message.attributes()));
            }
            if (fifoTopic) {
                entry.messageGroupId(message.hasOrderingKey() ? message.orderingKey() : UUID.randomUUID().toString())
                        .messageDeduplicationId(message.deduplicationId() != null
                                ? message.deduplicationId()
                                : UUID.randomUUID().toString());
            }
            entries.add(entry.build());
        }

        return PublishBatchRequest.builder()
                .topicArn(topicArn)
                .publishBatchRequestEntries(entries)
                .build();
    }

    private static Map<String, MessageAttributeValue> toMessageAttributes(Map<String, String> attributes) {
        Map<String, MessageAttributeValue> result = new HashMap<>(attributes.size() * 2);
        attributes.forEach((name, value) -> result.put(name, MessageAttributeValue.builder()
                .dataType(STRING_DATA_TYPE)
                .stringValue(value)
                .build()));
        return result;
    }

    /**
     * Completes each future from its entry in the response.
     */
    private void handleBatchResponse(PublishBatchResponse response, List<PendingSend> batch) {
        Set<Integer> completed = new HashSet<>();

        if (response.hasSuccessful()) {
            for (PublishBatchResultEntry entry : response.successful()) {
                int position = positionOf(entry.id(), batch.size());
                if (position >= 0) {
                    batch.get(position).future().complete(entry.messageId());
                    completed.add(position);
                }
            }
        }

        if (response.hasFailed() && !response.failed().isEmpty()) {
            log.error("Batch had {} failures out of {} messages. Failed IDs: {}",
                    response.failed().size(),
                    batch.size(),
                    LogSanitizer.sanitize(response.failed().stream()
                            .map(BatchResultErrorEntry::id)
                            .collect(Collectors.joining(", "))));

            for (BatchResultErrorEntry entry : response.failed()) {
                int position = positionOf(entry.id(), batch.size());
                if (position >= 0) {
                    batch.get(position).future().completeExceptionally(SnsErrorClassifier.classifyEntry(entry));
                    completed.add(position);
                }
            }
        }

        for (int i = 0; i < batch.size(); i++) {
            if (!completed.contains(i)) {
                batch.get(i).future().completeExceptionally(new FatalBackendException(null,
                        "Entry " + i + " missing from PublishBatch response"));
            }
        }

        if (completed.size() == batch.size()) {
            log.debug("Published batch of {} messages to {}", batch.size(), LogSanitizer.sanitize(topicArn));
        }
    }

    /**
     * Parses an entry id back into its batch position.
     *
     * @return the position, or -1 if the id is not one of ours
     */
    private static int positionOf(String id, int batchSize) {
        if (id == null || id.isEmpty()) {
            return -1;
        }
        try {
            int position = Integer.parseInt(id);
            return position >= 0 && position < batchSize ? position : -1;
        } catch (NumberFormatException e) {
            log.warn("Unexpected entry ID '{}' in PublishBatch response", LogSanitizer.sanitize(id));
            return -1;
        }
    }

    // ==========================================================================
    // Utilities
    // ==========================================================================

    private static int estimateSize(PubSubMessage message) {
        int size = estimateUtf8Size(message.payload());
        for (Map.Entry<String, String> attribute : message.attributes().entrySet()) {
            size += estimateUtf8Size(attribute.getKey()) + estimateUtf8Size(attribute.getValue());
        }
        return size;
    }

    /**
     * Estimates UTF-8 encoded size without allocating a byte array.
     * Exact for ASCII, a safe upper bound otherwise.
     */
    private static int estimateUtf8Size(String str) {
        if (str == null) {
            return 0;
        }

        int len = str.length();
        int size = 0;
        for (int i = 0; i < len; i++) {
            char c = str.charAt(i);
            if (c < 0x80) {
                size += 1;
            } else if (c < 0x800) {
                size += 2;
            } else {
                size += 3;
            }
        }
        return size;
    }

    private record PendingSend(PubSubMessage message, CompletableFuture<String> future) {}
}
