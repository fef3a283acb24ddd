package org.javai.jobguard.retry;

import org.javai.jobguard.FailureType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryDecisionTest {

    @Test
    void retry_carriesDelay() {
        assertThat(new RetryDecision.Retry(Duration.ofSeconds(5)).delay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(new RetryDecision.Retry(Duration.ZERO).delay()).isEqualTo(Duration.ZERO);
    }

    @Test
    void retry_rejectsNegativeOrMissingDelay() {
        assertThatThrownBy(() -> new RetryDecision.Retry(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryDecision.Retry(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void giveUp_requiresType() {
        assertThat(new RetryDecision.GiveUp(FailureType.EXHAUSTED).type()).isEqualTo(FailureType.EXHAUSTED);
        assertThatThrownBy(() -> new RetryDecision.GiveUp(null)).isInstanceOf(NullPointerException.class);
    }
}
