package io.clype.reactorpubsub.service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.model.FatalBackendException;
import io.clype.reactorpubsub.model.OrderingKeyPoisonedException;
import io.clype.reactorpubsub.model.OrderingKeyStatus;
import io.clype.reactorpubsub.model.PubSubMessage;
import io.clype.reactorpubsub.model.PublishResult;
import io.clype.reactorpubsub.model.PublisherStatus;
import io.clype.reactorpubsub.model.UnknownOrderingKeyException;
import io.clype.reactorpubsub.retry.BackoffRetry;
import io.clype.reactorpubsub.retry.RetryPolicy;
import io.clype.reactorpubsub.transport.PublishTransport;
import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Asynchronous publisher with per-ordering-key FIFO dispatch and resumable failure handling.
 *
 * <p>This publisher provides the following guarantees and features:</p>
 * <ul>
 *   <li><b>Per-key ordering:</b> Messages with the same ordering key are dispatched one at a
 *       time, in submission order, and resolve in submission order.</li>
 *   <li><b>Parallelism:</b> Different ordering keys, and messages without a key, are
 *       dispatched concurrently.</li>
 *   <li><b>Retry Logic:</b> Transient transport failures are retried with exponential
 *       backoff according to the dispatch {@link RetryPolicy}, without giving up the key's
 *       single in-flight slot.</li>
 *   <li><b>Poisoning:</b> When a dispatch finally fails, its key is paused. Messages still
 *       queued on the key, and messages published to it later, fail immediately with
 *       {@link OrderingKeyPoisonedException} and never reach the transport, until
 *       {@link #resume(String)} is called.</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * OrderedPublisher publisher = new OrderedPublisher(transport);
 *
 * publisher.publish(PubSubMessage.ordered("order-123", "{\"action\":\"created\"}"))
 *     .subscribe(result -> {
 *         if (result instanceof PublishResult.Failure failure) {
 *             log.error("Publish failed", failure.error());
 *             publisher.resume("order-123");
 *         }
 *     });
 *
 * publisher.flush(Duration.ofSeconds(10));
 * }</pre>
 *
 * <p><b>Result delivery:</b> {@link #publish(PubSubMessage)} dispatches eagerly; the returned
 * {@link Mono} only observes the outcome and never signals an error. Every message resolves
 * exactly once, to {@link PublishResult.Success} or {@link PublishResult.Failure}.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Per-key state is guarded by a per-key
 * monitor; neither the transport nor result subscribers are invoked while holding it, so a
 * subscriber may call {@link #resume(String)} or {@link #publish(PubSubMessage)} from its
 * callback. Messages that complete synchronously are dispatched iteratively, so a long
 * backlog on one key does not grow the stack.</p>
 *
 * <p><b>Resource Management:</b> This class implements {@link DisposableBean}; on context
 * shutdown it flushes outstanding messages (bounded wait) and disposes the retry scheduler
 * it created.</p>
 *
 * @see PublishTransport
 * @see io.clype.reactorpubsub.config.PubSubPublisherAutoConfiguration
 */
public class OrderedPublisher implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(OrderedPublisher.class);

    // ==========================================================================
    // Constants - Retry Configuration
    // ==========================================================================

    /** Initial backoff between dispatch retries. */
    private static final Duration RETRY_MIN_BACKOFF = Duration.ofMillis(100);

    /** Maximum backoff between dispatch retries. */
    private static final Duration RETRY_MAX_BACKOFF = Duration.ofSeconds(5);

    /** Total time a single message may spend retrying. */
    private static final Duration RETRY_BUDGET = Duration.ofSeconds(60);

    /** Jitter factor for retry backoff (0.5 = 50% randomization). */
    private static final double RETRY_JITTER = 0.5;

    /** Default dispatch retry policy: retries transient backend failures only. */
    public static final RetryPolicy DEFAULT_RETRY_POLICY =
            RetryPolicy.forTransientErrors(RETRY_MIN_BACKOFF, 2.0, RETRY_BUDGET)
                    .withMaxDelay(RETRY_MAX_BACKOFF)
                    .withJitter(RETRY_JITTER);

    /** Longest wait for outstanding messages on shutdown. */
    private static final Duration DESTROY_FLUSH_TIMEOUT = Duration.ofSeconds(30);

    // ==========================================================================
    // Fields
    // ==========================================================================

    private final PublishTransport transport;
    private final RetryPolicy retryPolicy;
    private final Scheduler retryScheduler;
    private final boolean ownsScheduler;
    private final PublisherMetrics metrics;

    private final ConcurrentHashMap<String, KeyState> keys = new ConcurrentHashMap<>();
    private final Set<PendingMessage> outstanding = ConcurrentHashMap.newKeySet();

    // ==========================================================================
    // Constructors
    // ==========================================================================

    /**
     * Creates a publisher with the default retry policy and no metrics.
     *
     * @param transport the transport that sends individual messages
     */
    public OrderedPublisher(PublishTransport transport) {
        this(transport, DEFAULT_RETRY_POLICY, null);
    }

    /**
     * Creates a publisher that owns its retry scheduler.
     *
     * @param transport   the transport that sends individual messages
     * @param retryPolicy policy applied to each dispatch
     * @param metrics     optional metrics collector (may be null)
     */
    public OrderedPublisher(PublishTransport transport, RetryPolicy retryPolicy, PublisherMetrics metrics) {
        this(transport, retryPolicy, metrics, Schedulers.newParallel("pubsub-publisher-retry", 2), true);
    }

    /**
     * Creates a publisher that schedules retry delays on the given scheduler. The caller
     * keeps ownership of the scheduler.
     *
     * @param transport      the transport that sends individual messages
     * @param retryPolicy    policy applied to each dispatch
     * @param metrics        optional metrics collector (may be null)
     * @param retryScheduler scheduler used for backoff delays and budget time
     * @throws NullPointerException if transport, retryPolicy or retryScheduler is null
     */
    public OrderedPublisher(PublishTransport transport, RetryPolicy retryPolicy, PublisherMetrics metrics,
                            Scheduler retryScheduler) {
        this(transport, retryPolicy, metrics, retryScheduler, false);
    }

    private OrderedPublisher(PublishTransport transport, RetryPolicy retryPolicy, PublisherMetrics metrics,
                             Scheduler retryScheduler, boolean ownsScheduler) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
        this.metrics = metrics;
    }

    // ==========================================================================
    // Public API
    // ==========================================================================

    /**
     * Publishes a message.
     *
     * <p>Without an ordering key the message is dispatched immediately. With one, it is
     * dispatched after every earlier message on the same key has resolved, or failed
     * immediately if the key is paused.</p>
     *
     * @param message the message to publish (must not be null)
     * @return a hot Mono emitting the message's result; never errors
     * @throws NullPointerException if message is null
     */
    public Mono<PublishResult> publish(PubSubMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        PendingMessage pending = new PendingMessage(message);
        outstanding.add(pending);

        if (!message.hasOrderingKey()) {
            send(pending, null);
            return pending.result();
        }

        KeyState state = keys.computeIfAbsent(message.orderingKey(), KeyState::new);
        PendingMessage first = null;
        synchronized (state) {
            if (state.pausedError != null) {
                state.resolutions.add(new Resolution(pending, PublishResult.failure(
                        new OrderingKeyPoisonedException(state.key, state.pausedError))));
                if (metrics != null) {
                    metrics.recordPoisoned(1);
                }
            } else if (state.inFlight) {
                state.queue.addLast(pending);
            } else {
                state.inFlight = true;
                first = handOff(state, pending);
            }
        }

        emitResolutions(state);
        if (first != null) {
            drain(first, state);
        }
        return pending.result();
    }

    /**
     * Publishes a stream of messages, emitting their results in submission order.
     *
     * @param messages the messages to publish
     * @return a Flux of results, one per message
     * @throws NullPointerException if messages is null
     */
    public Flux<PublishResult> publishAll(Flux<PubSubMessage> messages) {
        Objects.requireNonNull(messages, "messages");
        return messages.map(this::publish).concatMap(Function.identity());
    }

    /**
     * Publishes domain events after converting each to {@link PubSubMessage}.
     *
     * @param <T> the domain event type
     * @param events the stream of events to publish
     * @param toMessage function to convert each event to a message
     * @return a Flux of results, one per event
     * @throws NullPointerException if either parameter is null
     */
    public <T> Flux<PublishResult> publishAll(Flux<T> events, Function<T, PubSubMessage> toMessage) {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(toMessage, "toMessage");
        return publishAll(events.map(toMessage));
    }

    /**
     * Clears the paused state of an ordering key so publishing on it can continue.
     *
     * <p>Messages that already failed stay failed; nothing is replayed. Resuming an active
     * key does nothing.</p>
     *
     * @param orderingKey the key to resume
     * @throws UnknownOrderingKeyException if no message was ever published with this key
     */
    public void resume(String orderingKey) {
        Objects.requireNonNull(orderingKey, "orderingKey cannot be null");
        KeyState state = keys.get(orderingKey);
        if (state == null) {
            throw new UnknownOrderingKeyException(orderingKey);
        }

        synchronized (state) {
            if (state.pausedError == null) {
                return;
            }
            state.pausedError = null;
        }

        log.info("Resumed publishing on ordering key '{}'", LogSanitizer.sanitize(orderingKey));
        if (metrics != null) {
            metrics.recordResume();
        }
    }

    /**
     * Returns a Mono that completes once every message submitted before this call has
     * resolved, queued messages included.
     */
    public Mono<Void> flush() {
        List<Mono<PublishResult>> snapshot = new ArrayList<>(outstanding.size());
        for (PendingMessage pending : outstanding) {
            snapshot.add(pending.result());
        }
        return Mono.when(snapshot);
    }

    /**
     * Blocks until every message submitted before this call has resolved, or the timeout
     * passes. Must not be called from a non-blocking thread.
     *
     * @param timeout longest time to wait
     * @return true if all messages resolved in time
     */
    public boolean flush(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Boolean drained = flush()
                .then(Mono.just(Boolean.TRUE))
                .timeout(timeout, Mono.just(Boolean.FALSE))
                .block();
        return Boolean.TRUE.equals(drained);
    }

    /**
     * Returns the status of an ordering key, or empty if it was never used.
     */
    public Optional<OrderingKeyStatus> orderingKeyStatus(String orderingKey) {
        KeyState state = keys.get(orderingKey);
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(state.pausedError == null ? OrderingKeyStatus.ACTIVE : OrderingKeyStatus.PAUSED);
    }

    public PublisherStatus status() {
        int paused = 0;
        for (KeyState state : keys.values()) {
            if (state.pausedError != null) {
                paused++;
            }
        }
        return new PublisherStatus(outstanding.size(), keys.size(), paused);
    }

    // ==========================================================================
    // Dispatch
    // ==========================================================================

    /**
     * Dispatches {@code first} and then every message handed off to this thread while it
     * was sending. A send that completes synchronously parks the key's next message in
     * {@link KeyState#handedOff} rather than dispatching it from inside the callback.
     */
    private void drain(PendingMessage first, KeyState state) {
        Thread self = Thread.currentThread();
        PendingMessage current = first;
        while (current != null) {
            synchronized (state) {
                state.dispatchingThread = self;
            }
            send(current, state);
            synchronized (state) {
                if (state.dispatchingThread != self) {
                    // completed on another thread, which now owns the key's dispatch
                    return;
                }
                state.dispatchingThread = null;
                current = state.handedOff;
                state.handedOff = null;
            }
        }
    }

    /**
     * Called under the key monitor once {@code next} holds the key's in-flight slot. Returns
     * the message if the caller must drain it, or null if a drain loop further up this
     * thread's stack will pick it up.
     */
    private static PendingMessage handOff(KeyState state, PendingMessage next) {
        if (state.dispatchingThread == Thread.currentThread()) {
            state.handedOff = next;
            return null;
        }
        return next;
    }

    /**
     * Sends one message through the transport with retries, then hands the outcome to
     * {@link #onDispatched}. {@code state} is null for unordered messages.
     */
    private void send(PendingMessage pending, KeyState state) {
        final long startTime = System.nanoTime();
        if (metrics != null) {
            metrics.incrementActiveRequests();
        }

        String operation = state == null
                ? "publish"
                : "publish on ordering key '" + state.key + "'";

        Mono.defer(() -> Mono.fromFuture(transport.send(pending.message)))
                .switchIfEmpty(Mono.error(() -> new FatalBackendException(null, "Transport returned no message id")))
                .retryWhen(BackoffRetry.forPolicy(retryPolicy, retryScheduler, operation,
                        metrics == null ? null : metrics::recordRetry))
                .subscribe(
                        messageId -> onDispatched(pending, state, PublishResult.success(messageId), startTime),
                        error -> onDispatched(pending, state, PublishResult.failure(error), startTime));
    }

    /**
     * Resolves a dispatched message and advances its key: the next queued message is
     * dispatched on success; on failure the key is paused and its queue is failed.
     */
    private void onDispatched(PendingMessage pending, KeyState state, PublishResult result, long startTime) {
        recordOutcome(result, startTime);

        if (state == null) {
            if (result instanceof PublishResult.Failure failure) {
                log.error("Failed to publish message: {}", LogSanitizer.sanitize(failure.error().getMessage()));
            }
            resolve(pending, result);
            return;
        }

        PendingMessage next = null;
        synchronized (state) {
            if (result instanceof PublishResult.Failure failure) {
                Throwable error = failure.error();
                state.pausedError = error;
                state.inFlight = false;

                List<PendingMessage> poisoned = new ArrayList<>(state.queue);
                state.queue.clear();
                log.warn("Pausing ordering key '{}' after failed publish, failing {} queued message(s): {}",
                        LogSanitizer.sanitize(state.key), poisoned.size(),
                        LogSanitizer.sanitize(error.getMessage()));

                state.resolutions.add(new Resolution(pending, result));
                for (PendingMessage queued : poisoned) {
                    state.resolutions.add(new Resolution(queued,
                            PublishResult.failure(new OrderingKeyPoisonedException(state.key, error))));
                }
                if (metrics != null && !poisoned.isEmpty()) {
                    metrics.recordPoisoned(poisoned.size());
                }
            } else {
                state.resolutions.add(new Resolution(pending, result));
                PendingMessage queued = state.queue.pollFirst();
                if (queued == null) {
                    state.inFlight = false;
                } else {
                    next = handOff(state, queued);
                }
            }
        }

        emitResolutions(state);
        if (next != null) {
            drain(next, state);
        }
    }

    /**
     * Emits the key's pending resolutions in the order they were queued. Only one thread
     * emits at a time; a caller arriving while another emits (including a subscriber
     * publishing from its callback) leaves its resolutions to that thread.
     */
    private void emitResolutions(KeyState state) {
        if (state.emitting.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            Resolution resolution;
            while ((resolution = state.resolutions.poll()) != null) {
                resolve(resolution.pending(), resolution.result());
            }
            missed = state.emitting.addAndGet(-missed);
        } while (missed != 0);
    }

    private void recordOutcome(PublishResult result, long startTime) {
        if (metrics == null) {
            return;
        }
        metrics.decrementActiveRequests();
        if (result.isSuccess()) {
            metrics.recordSuccess(System.nanoTime() - startTime);
        } else {
            metrics.recordFailure();
        }
    }

    private void resolve(PendingMessage pending, PublishResult result) {
        Sinks.EmitResult emitResult = pending.sink.tryEmitValue(result);
        if (emitResult.isFailure()) {
            log.warn("Result for a message was already resolved ({})", emitResult);
        }
        outstanding.remove(pending);
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Flushes outstanding messages and disposes the retry scheduler if this publisher
     * created it. Called automatically by Spring's lifecycle management.
     */
    @Override
    public void destroy() {
        if (!flush(DESTROY_FLUSH_TIMEOUT)) {
            log.warn("{} message(s) still unresolved after waiting {} on shutdown",
                    outstanding.size(), DESTROY_FLUSH_TIMEOUT);
        }
        if (ownsScheduler) {
            retryScheduler.dispose();
        }
    }

    // ==========================================================================
    // State
    // ==========================================================================

    /**
     * Per-key dispatch state. {@code queue} holds messages waiting behind the in-flight
     * one; it is non-empty only while {@code inFlight} is true. Results are queued on
     * {@code resolutions} under the monitor and emitted after it is released.
     */
    private static final class KeyState {
        private final String key;
        private final Deque<PendingMessage> queue = new ArrayDeque<>();
        private final Queue<Resolution> resolutions = new ConcurrentLinkedQueue<>();
        private final AtomicInteger emitting = new AtomicInteger();
        private boolean inFlight;
        private volatile Throwable pausedError;
        private Thread dispatchingThread;
        private PendingMessage handedOff;

        private KeyState(String key) {
            this.key = key;
        }
    }

    /**
     * A published message awaiting its result. Messages without a deduplication id get a
     * random one here, so every retry of the message carries the same id.
     */
    private static final class PendingMessage {
        private final PubSubMessage message;
        private final Sinks.One<PublishResult> sink = Sinks.one();

        private PendingMessage(PubSubMessage message) {
            this.message = message.deduplicationId() != null
                    ? message
                    : message.withDeduplicationId(UUID.randomUUID().toString());
        }

        private Mono<PublishResult> result() {
            return sink.asMono();
        }
    }

    private record Resolution(PendingMessage pending, PublishResult result) {
    }
}
