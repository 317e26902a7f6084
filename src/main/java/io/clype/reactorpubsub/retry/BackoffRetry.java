package io.clype.reactorpubsub.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

/**
 * Reactor {@link Retry} driven by a {@link RetryPolicy}.
 *
 * <p>Same semantics as {@link EventuallyConsistentRetrier}: non-retryable failures
 * propagate unchanged, retryable ones are retried with exponential backoff until the
 * elapsed time plus the next delay would overrun the budget, at which point the
 * sequence fails with {@link RetryBudgetExhaustedException}.</p>
 *
 * <p>Elapsed time is read from the given {@link Scheduler}'s clock and delays are
 * scheduled on it, so a {@code VirtualTimeScheduler} makes the whole sequence
 * deterministic in tests.</p>
 */
public final class BackoffRetry {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetry.class);

    private BackoffRetry() {
    }

    /**
     * Creates the retry companion for a policy.
     *
     * @param policy    backoff and budget
     * @param scheduler clock and timer for delays
     * @param operation used for logging and error messages
     * @param onRetry   invoked before each scheduled retry (may be null)
     * @return a {@link Retry} for {@code retryWhen}
     */
    public static Retry forPolicy(RetryPolicy policy, Scheduler scheduler, String operation, Runnable onRetry) {
        Objects.requireNonNull(policy, "policy cannot be null");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");
        Backoff backoff = new Backoff(policy);

        // generateCompanion runs once per subscription, so the start time is per attempt sequence
        return Retry.from(companion -> {
            long startedAt = scheduler.now(TimeUnit.NANOSECONDS);
            return companion.concatMap(retrySignal -> {
                Throwable failure = retrySignal.failure();
                long attempt = retrySignal.totalRetries() + 1;

                if (!policy.isRetryable(failure)) {
                    return Mono.error(failure);
                }

                Duration delay = backoff.delayAfter(attempt);
                Duration elapsed = Duration.ofNanos(scheduler.now(TimeUnit.NANOSECONDS) - startedAt);
                if (!backoff.fitsBudget(elapsed, delay)) {
                    return Mono.error(new RetryBudgetExhaustedException(operation, attempt, elapsed, failure));
                }

                log.warn("Retrying {} (attempt {}, backoff {}ms): {}",
                        LogSanitizer.sanitize(operation), attempt, delay.toMillis(),
                        LogSanitizer.sanitize(failure.getMessage()));
                if (onRetry != null) {
                    onRetry.run();
                }
                return Mono.delay(delay, scheduler);
            });
        });
    }
}
