package org.javai.jobguard.retry;

import org.javai.jobguard.FailureType;

import java.time.Duration;
import java.util.Objects;

/**
 * What the executor does after a failed attempt.
 */
sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * Stop and surface the failure.
     */
    record GiveUp(FailureType type) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(type, "type must not be null");
        }
    }
}
