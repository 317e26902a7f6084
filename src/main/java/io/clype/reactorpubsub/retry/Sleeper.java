package io.clype.reactorpubsub.retry;

import java.time.Duration;

/**
 * Suspends the calling thread. Injected into {@link EventuallyConsistentRetrier} so tests
 * can replace real sleeping with a fake clock.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps for {@code duration}.
     *
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns a sleeper backed by {@link Thread#sleep(long, int)}.
     */
    static Sleeper system() {
        return duration -> {
            long nanos = duration.toNanos();
            Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
        };
    }
}
