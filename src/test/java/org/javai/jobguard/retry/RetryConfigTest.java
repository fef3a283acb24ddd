package org.javai.jobguard.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryConfigTest {

    @Test
    void defaults_matchDocumentedValues() {
        RetryConfig config = RetryConfig.defaults();

        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.initialDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.backoffMultiplier()).isEqualTo(2.0);
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> RetryConfig.defaults().withMaxAttempts(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test
    void rejectsNonPositiveInitialDelay() {
        assertThatThrownBy(() -> RetryConfig.defaults().withInitialDelay(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialDelay");
    }

    @Test
    void rejectsMaxDelayBelowInitialDelay() {
        assertThatThrownBy(() -> RetryConfig.of(3, Duration.ofSeconds(10), Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDelay");
    }

    @Test
    void rejectsShrinkingOrNonFiniteMultiplier() {
        assertThatThrownBy(() -> RetryConfig.defaults().withBackoffMultiplier(0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backoffMultiplier");
        assertThatThrownBy(() -> RetryConfig.defaults().withBackoffMultiplier(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryConfig.defaults().withBackoffMultiplier(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withers_leaveOriginalUntouched() {
        RetryConfig original = RetryConfig.defaults();

        RetryConfig changed = original.withMaxAttempts(5).withMaxDelay(Duration.ofMinutes(2));

        assertThat(original.maxAttempts()).isEqualTo(3);
        assertThat(changed.maxAttempts()).isEqualTo(5);
        assertThat(changed.maxDelay()).isEqualTo(Duration.ofMinutes(2));
        assertThat(changed.initialDelay()).isEqualTo(original.initialDelay());
    }
}
