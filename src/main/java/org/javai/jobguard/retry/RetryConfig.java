package org.javai.jobguard.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings for one logical operation.
 *
 * @param maxAttempts total invocation budget, at least 1
 * @param initialDelay delay before the second attempt, positive
 * @param maxDelay ceiling for any single delay, not below {@code initialDelay}
 * @param backoffMultiplier growth factor between consecutive delays, at least 1.0
 */
public record RetryConfig(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double backoffMultiplier
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private static final RetryConfig DEFAULTS = new RetryConfig(
            DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_BACKOFF_MULTIPLIER);

    public RetryConfig {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (initialDelay.isZero() || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be > 0, was: " + initialDelay);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= initialDelay, was: " + maxDelay + " < " + initialDelay);
        }
        if (Double.isNaN(backoffMultiplier) || Double.isInfinite(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be a finite value >= 1.0, was: " + backoffMultiplier);
        }
        try {
            maxDelay.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("maxDelay is too large: " + maxDelay, e);
        }
    }

    /**
     * 3 attempts, 5s initial delay, 60s ceiling, doubling.
     */
    public static RetryConfig defaults() {
        return DEFAULTS;
    }

    public static RetryConfig of(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffMultiplier);
    }

    public RetryConfig withInitialDelay(Duration initialDelay) {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffMultiplier);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffMultiplier);
    }

    public RetryConfig withBackoffMultiplier(double backoffMultiplier) {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffMultiplier);
    }
}
