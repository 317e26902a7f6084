package io.clype.reactorpubsub.retry;

/**
 * Thrown when a retry loop is interrupted while waiting between attempts.
 *
 * <p>Distinct from {@link RetryBudgetExhaustedException}: the budget was not used up,
 * the caller asked to stop. The thread's interrupt flag is restored before this is thrown.
 * The failure that led to the aborted wait is available as {@link #getCause()}.</p>
 */
public class RetryCancelledException extends RuntimeException {

    private final String operation;
    private final long attempts;

    public RetryCancelledException(String operation, long attempts, Throwable lastError) {
        super(operation + " was cancelled after " + attempts + " attempt(s)", lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public long getAttempts() {
        return attempts;
    }
}
