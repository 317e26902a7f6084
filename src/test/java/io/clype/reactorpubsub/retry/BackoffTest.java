package io.clype.reactorpubsub.retry;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffTest {

    private static final RetryPolicy POLICY =
            RetryPolicy.forAssertions(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));

    @Test
    void testDelaysGrowExponentially() {
        Backoff backoff = new Backoff(POLICY);

        assertThat(backoff.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayAfter(6)).isEqualTo(Duration.ofSeconds(32));
    }

    @Test
    void testDelaysStrictlyIncreaseWithoutCap() {
        Backoff backoff = new Backoff(RetryPolicy.forAssertions(Duration.ofMillis(10), 1.1, Duration.ofSeconds(60)));

        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 50; attempt++) {
            Duration delay = backoff.delayAfter(attempt);
            assertThat(delay).isGreaterThan(previous);
            previous = delay;
        }
    }

    @Test
    void testCapLimitsDelay() {
        Backoff backoff = new Backoff(POLICY.withMaxDelay(Duration.ofSeconds(5)));

        assertThat(backoff.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayAfter(4)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.delayAfter(40)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void testJitterIsAppliedAfterCap() {
        RetryPolicy policy = POLICY.withMaxDelay(Duration.ofSeconds(4)).withJitter(0.5);

        // r = 0 shrinks by a quarter, r close to 1 grows by almost a quarter
        assertThat(new Backoff(policy, () -> 0.0).delayAfter(10)).isEqualTo(Duration.ofSeconds(3));
        assertThat(new Backoff(policy, () -> 0.5).delayAfter(10)).isEqualTo(Duration.ofSeconds(4));
        assertThat(new Backoff(policy, () -> 0.999).delayAfter(10)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void testHugeAttemptNumbersSaturate() {
        Backoff backoff = new Backoff(POLICY);

        assertThat(backoff.delayAfter(10_000)).isEqualTo(Duration.ofNanos(Long.MAX_VALUE));
    }

    @Test
    void testBudgetCheck() {
        Backoff backoff = new Backoff(POLICY);

        assertThat(backoff.fitsBudget(Duration.ofSeconds(15), Duration.ofSeconds(16))).isTrue();
        assertThat(backoff.fitsBudget(Duration.ofSeconds(30), Duration.ofSeconds(30))).isTrue();
        assertThat(backoff.fitsBudget(Duration.ofSeconds(31), Duration.ofSeconds(32))).isFalse();
        assertThat(backoff.fitsBudget(Duration.ofSeconds(61), Duration.ofMillis(1))).isFalse();
    }

    @Test
    void testZeroBudgetNeverFits() {
        Backoff backoff = new Backoff(RetryPolicy.forAssertions(Duration.ofSeconds(1), 2.0, Duration.ZERO));

        assertThat(backoff.fitsBudget(Duration.ZERO, Duration.ZERO)).isFalse();
    }

    @Test
    void testAttemptsAreOneBased() {
        assertThatThrownBy(() -> new Backoff(POLICY).delayAfter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
