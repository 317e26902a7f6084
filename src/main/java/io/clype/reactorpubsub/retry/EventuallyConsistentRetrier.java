package io.clype.reactorpubsub.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import io.clype.reactorpubsub.util.LogSanitizer;

/**
 * Repeats a check until it passes or the time budget of a {@link RetryPolicy} runs out.
 *
 * <p>Intended for assertions against eventually-consistent backends, where a write
 * (creating a topic, deleting it) takes a while to become visible to reads.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * EventuallyConsistentRetrier retrier = EventuallyConsistentRetrier.system();
 * RetryPolicy policy = RetryPolicy.forAssertions(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));
 *
 * retrier.retry(() -> assertThat(admin.topicExists("orders").block()).isTrue(), policy);
 * }</pre>
 *
 * <p><b>Outcomes:</b></p>
 * <ul>
 *   <li>The check returns normally: {@code retry} returns.</li>
 *   <li>The check fails with an error the policy does not retry: that error propagates unchanged.</li>
 *   <li>The next wait would overrun the budget: {@link RetryBudgetExhaustedException}
 *       wrapping the last error.</li>
 *   <li>The thread is interrupted while waiting: {@link RetryCancelledException}.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Instances hold no per-call state and can be shared.</p>
 */
public class EventuallyConsistentRetrier {

    private static final Logger log = LoggerFactory.getLogger(EventuallyConsistentRetrier.class);

    private static final String DEFAULT_OPERATION = "check";

    private final Sleeper sleeper;
    private final Ticker ticker;
    private final DoubleSupplier random;

    /**
     * Creates a retrier that sleeps for real and reads the system ticker.
     */
    public static EventuallyConsistentRetrier system() {
        return new EventuallyConsistentRetrier(Sleeper.system(), Ticker.systemTicker());
    }

    public EventuallyConsistentRetrier(Sleeper sleeper, Ticker ticker) {
        this(sleeper, ticker, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param sleeper used for waits between attempts
     * @param ticker  source of elapsed time for the budget
     * @param random  source of uniform values in [0, 1) for jitter
     */
    public EventuallyConsistentRetrier(Sleeper sleeper, Ticker ticker, DoubleSupplier random) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Runs {@code check} until it returns normally.
     *
     * @param check  the assertion to repeat
     * @param policy backoff and budget
     * @throws RetryBudgetExhaustedException if no attempt succeeded within the budget
     * @throws RetryCancelledException       if interrupted while waiting
     */
    public void retry(Runnable check, RetryPolicy policy) {
        retry(DEFAULT_OPERATION, check, policy);
    }

    /**
     * Runs {@code check} until it returns normally, naming the operation in logs and errors.
     */
    public void retry(String operation, Runnable check, RetryPolicy policy) {
        Objects.requireNonNull(check, "check cannot be null");
        retryForValue(operation, () -> {
            check.run();
            return Boolean.TRUE;
        }, policy);
    }

    /**
     * Calls {@code supplier} until it returns normally and returns its value.
     */
    public <T> T retryForValue(Supplier<T> supplier, RetryPolicy policy) {
        return retryForValue(DEFAULT_OPERATION, supplier, policy);
    }

    /**
     * Calls {@code supplier} until it returns normally and returns its value,
     * naming the operation in logs and errors.
     */
    public <T> T retryForValue(String operation, Supplier<T> supplier, RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(supplier, "supplier cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        Backoff backoff = new Backoff(policy, random);
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        long attempt = 0;

        while (true) {
            attempt++;
            try {
                T value = supplier.get();
                if (attempt > 1) {
                    log.debug("{} succeeded on attempt {} after {} ms",
                            LogSanitizer.sanitize(operation), attempt, stopwatch.elapsed().toMillis());
                }
                return value;
            } catch (RuntimeException | AssertionError e) {
                if (!policy.isRetryable(e)) {
                    throw e;
                }

                Duration delay = backoff.delayAfter(attempt);
                Duration elapsed = stopwatch.elapsed();
                if (!backoff.fitsBudget(elapsed, delay)) {
                    log.warn("{} gave up after {} attempt(s) in {} ms: {}",
                            LogSanitizer.sanitize(operation), attempt, elapsed.toMillis(),
                            LogSanitizer.sanitize(e.getMessage()));
                    throw new RetryBudgetExhaustedException(operation, attempt, elapsed, e);
                }

                log.debug("{} failed on attempt {}, retrying in {} ms: {}",
                        LogSanitizer.sanitize(operation), attempt, delay.toMillis(),
                        LogSanitizer.sanitize(e.getMessage()));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryCancelledException(operation, attempt, e);
                }
            }
        }
    }
}
