package org.javai.jobguard.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    private final RetryConfig config = new RetryConfig(10, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);

    @Test
    void exponential_doublesUntilCeiling() {
        BackoffPolicy backoff = BackoffPolicy.exponential();

        List<Long> delays = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            delays.add(backoff.delayForAttempt(i, config).toMillis());
        }

        assertThat(delays).containsExactly(100L, 200L, 400L, 800L, 1000L, 1000L);
    }

    @Test
    void exponential_isNonDecreasingAndBounded() {
        BackoffPolicy backoff = BackoffPolicy.exponential();
        RetryConfig slowGrowth = new RetryConfig(50, Duration.ofMillis(7), Duration.ofSeconds(3), 1.3);

        Duration previous = Duration.ZERO;
        for (int i = 0; i < 50; i++) {
            Duration delay = backoff.delayForAttempt(i, slowGrowth);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            assertThat(delay).isLessThanOrEqualTo(slowGrowth.maxDelay());
            previous = delay;
        }
    }

    @Test
    void exponential_saturatesForHugeIndices() {
        BackoffPolicy backoff = BackoffPolicy.exponential();

        assertThat(backoff.delayForAttempt(10_000, config)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delayForAttempt(Integer.MAX_VALUE, config)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void exponential_multiplierOfOneKeepsInitialDelay() {
        RetryConfig flat = config.withBackoffMultiplier(1.0);

        assertThat(BackoffPolicy.exponential().delayForAttempt(5, flat)).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void exponential_isPure() {
        BackoffPolicy backoff = BackoffPolicy.exponential();

        assertThat(backoff.delayForAttempt(3, config)).isEqualTo(backoff.delayForAttempt(3, config));
    }

    @Test
    void negativeIndex_isRejected() {
        assertThatThrownBy(() -> BackoffPolicy.exponential().delayForAttempt(-1, config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attemptIndex");
        assertThatThrownBy(() -> BackoffPolicy.fixed().delayForAttempt(-1, config))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fixed_alwaysReturnsInitialDelay() {
        BackoffPolicy backoff = BackoffPolicy.fixed();

        assertThat(backoff.delayForAttempt(0, config)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.delayForAttempt(7, config)).isEqualTo(Duration.ofMillis(100));
    }
}
