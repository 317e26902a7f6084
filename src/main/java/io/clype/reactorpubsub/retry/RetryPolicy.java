package io.clype.reactorpubsub.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

import io.clype.reactorpubsub.model.TransientBackendException;

/**
 * Bounded exponential backoff policy shared by {@link EventuallyConsistentRetrier}
 * and {@link BackoffRetry}.
 *
 * <p>The n-th delay (1-based) is {@code initialDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay} when one is set, then randomized by {@code jitterFactor}. A retry is
 * only attempted while the elapsed time plus the next delay stays within
 * {@code maxElapsedTime}; a zero budget therefore means exactly one attempt.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.forAssertions(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60))
 *         .withJitter(0.2);
 * }</pre>
 *
 * @param initialDelay    delay before the first retry (must be positive)
 * @param multiplier      growth factor between successive delays (must be greater than 1)
 * @param maxDelay        optional upper bound for a single delay (may be null)
 * @param maxElapsedTime  total time budget for all attempts (zero or positive)
 * @param jitterFactor    randomization range in [0, 1); 0 disables jitter
 * @param retryableErrors error types that trigger a retry; anything else is fatal
 */
public record RetryPolicy(
    Duration initialDelay,
    double multiplier,
    Duration maxDelay,
    Duration maxElapsedTime,
    double jitterFactor,
    Set<Class<? extends Throwable>> retryableErrors
) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay cannot be null");
        Objects.requireNonNull(maxElapsedTime, "maxElapsedTime cannot be null");
        Objects.requireNonNull(retryableErrors, "retryableErrors cannot be null");
        if (initialDelay.isZero() || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (!(multiplier > 1.0)) {
            throw new IllegalArgumentException("multiplier must be greater than 1, got: " + multiplier);
        }
        if (maxElapsedTime.isNegative()) {
            throw new IllegalArgumentException("maxElapsedTime cannot be negative");
        }
        if (maxDelay != null && maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than initialDelay");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1), got: " + jitterFactor);
        }
        retryableErrors = Set.copyOf(retryableErrors);
    }

    /**
     * Policy for eventually-consistent checks: retries on {@link AssertionError} only.
     */
    public static RetryPolicy forAssertions(Duration initialDelay, double multiplier, Duration maxElapsedTime) {
        return new RetryPolicy(initialDelay, multiplier, null, maxElapsedTime, 0.0,
                Set.of(AssertionError.class));
    }

    /**
     * Policy for backend calls: retries on {@link TransientBackendException} only.
     */
    public static RetryPolicy forTransientErrors(Duration initialDelay, double multiplier, Duration maxElapsedTime) {
        return new RetryPolicy(initialDelay, multiplier, null, maxElapsedTime, 0.0,
                Set.of(TransientBackendException.class));
    }

    /**
     * Policy that never retries.
     */
    public static RetryPolicy noRetries() {
        return new RetryPolicy(Duration.ofMillis(1), 2.0, null, Duration.ZERO, 0.0, Set.of());
    }

    public RetryPolicy withJitter(double jitterFactor) {
        return new RetryPolicy(initialDelay, multiplier, maxDelay, maxElapsedTime, jitterFactor, retryableErrors);
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(initialDelay, multiplier, maxDelay, maxElapsedTime, jitterFactor, retryableErrors);
    }

    public RetryPolicy withRetryableErrors(Set<Class<? extends Throwable>> retryableErrors) {
        return new RetryPolicy(initialDelay, multiplier, maxDelay, maxElapsedTime, jitterFactor, retryableErrors);
    }

    /**
     * Returns true if {@code error} is an instance of one of the retryable types.
     */
    public boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        for (Class<? extends Throwable> type : retryableErrors) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
