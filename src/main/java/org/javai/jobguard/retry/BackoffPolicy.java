package org.javai.jobguard.retry;

import java.time.Duration;

/**
 * Computes the delay that follows a failed attempt. Implementations must be pure: the same
 * attempt index and config always give the same delay.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attemptIndex zero-based index of the attempt that just failed
     * @param config the retry settings
     * @return the delay before the next attempt, never above {@link RetryConfig#maxDelay()}
     */
    Duration delayForAttempt(int attemptIndex, RetryConfig config);

    /**
     * {@code initialDelay * multiplier^attemptIndex}, capped at {@code maxDelay}.
     */
    static BackoffPolicy exponential() {
        return ExponentialBackoff.INSTANCE;
    }

    /**
     * Always {@code initialDelay}.
     */
    static BackoffPolicy fixed() {
        return (attemptIndex, config) -> {
            ExponentialBackoff.requireValidIndex(attemptIndex);
            return config.initialDelay();
        };
    }
}
