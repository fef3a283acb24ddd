package org.javai.jobguard.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Progress of one retry sequence.
 *
 * @param attemptIndex The current attempt (0-based)
 * @param startedAt When the first attempt began
 */
record RetryContext(int attemptIndex, Instant startedAt) {

    RetryContext {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    static RetryContext first(Instant now) {
        return new RetryContext(0, now);
    }

    RetryContext next() {
        return new RetryContext(attemptIndex + 1, startedAt);
    }

    /**
     * 1-based attempt number, for messages and reports.
     */
    int attemptNumber() {
        return attemptIndex + 1;
    }

    boolean isLastAttempt(RetryConfig config) {
        return attemptIndex >= config.maxAttempts() - 1;
    }

    Duration elapsedAt(Instant now) {
        Duration elapsed = Duration.between(startedAt, now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
