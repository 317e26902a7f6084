package io.clype.reactorpubsub.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes retry delays for a {@link RetryPolicy}.
 *
 * <p>Growth is strictly multiplicative; the cap and the jitter are applied afterwards,
 * in that order. Jitter follows {@code delay * (1 + (r - 0.5) * jitterFactor)}.</p>
 */
public final class Backoff {

    private final RetryPolicy policy;
    private final DoubleSupplier random;

    public Backoff(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param policy the policy providing delays, cap and jitter
     * @param random source of uniform values in [0, 1), only used when jitter is enabled
     */
    public Backoff(RetryPolicy policy, DoubleSupplier random) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Returns the delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayAfter(long attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive, got: " + attempt);
        }
        double nanos = policy.initialDelay().toNanos() * Math.pow(policy.multiplier(), attempt - 1);
        if (policy.maxDelay() != null) {
            nanos = Math.min(nanos, policy.maxDelay().toNanos());
        }
        if (policy.jitterFactor() > 0.0) {
            nanos = nanos * (1.0 + (random.getAsDouble() - 0.5) * policy.jitterFactor());
        }
        // saturates at Long.MAX_VALUE for very late attempts
        return Duration.ofNanos((long) Math.min(nanos, (double) Long.MAX_VALUE));
    }

    /**
     * Returns true if another attempt fits in the budget after waiting {@code delay}.
     */
    public boolean fitsBudget(Duration elapsed, Duration delay) {
        Duration budget = policy.maxElapsedTime();
        if (budget.isZero()) {
            return false;
        }
        return elapsed.compareTo(budget) <= 0 && delay.compareTo(budget.minus(elapsed)) <= 0;
    }
}
