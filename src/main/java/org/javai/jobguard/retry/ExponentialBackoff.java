package org.javai.jobguard.retry;

import java.time.Duration;

/**
 * Multiplicative backoff: {@code initialDelay * multiplier^attemptIndex}, capped at {@code maxDelay}.
 *
 * <p>The product is computed in floating point nanoseconds, so large attempt indices saturate at
 * the ceiling instead of overflowing.
 */
final class ExponentialBackoff implements BackoffPolicy {

    static final ExponentialBackoff INSTANCE = new ExponentialBackoff();

    private ExponentialBackoff() {}

    @Override
    public Duration delayForAttempt(int attemptIndex, RetryConfig config) {
        requireValidIndex(attemptIndex);

        long maxNanos = config.maxDelay().toNanos();
        double nanos = config.initialDelay().toNanos() * Math.pow(config.backoffMultiplier(), attemptIndex);
        if (Double.isNaN(nanos) || nanos >= maxNanos) {
            return config.maxDelay();
        }
        return Duration.ofNanos((long) nanos);
    }

    static void requireValidIndex(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, was: " + attemptIndex);
        }
    }
}
