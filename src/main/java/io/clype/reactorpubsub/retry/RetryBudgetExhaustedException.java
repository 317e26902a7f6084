package io.clype.reactorpubsub.retry;

import java.time.Duration;

/**
 * Thrown when the retry budget of a {@link RetryPolicy} runs out before an attempt
 * succeeds. The last observed failure is available as {@link #getCause()}.
 */
public class RetryBudgetExhaustedException extends RuntimeException {

    private final String operation;
    private final long attempts;
    private final Duration elapsed;

    public RetryBudgetExhaustedException(String operation, long attempts, Duration elapsed, Throwable lastError) {
        super(String.format("%s did not succeed after %d attempt(s) in %d ms: %s",
                operation, attempts, elapsed.toMillis(),
                lastError == null ? "no error recorded" : lastError.getMessage()), lastError);
        this.operation = operation;
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public String getOperation() {
        return operation;
    }

    public long getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
