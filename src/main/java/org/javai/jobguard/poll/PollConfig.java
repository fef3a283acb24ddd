package org.javai.jobguard.poll;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed interval between status queries and the wall-clock budget for reaching a terminal state.
 *
 * @param interval wait between consecutive queries, positive
 * @param timeout total polling budget, positive
 */
public record PollConfig(Duration interval, Duration timeout) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

    public PollConfig {
        Objects.requireNonNull(interval, "interval must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, was: " + interval);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0, was: " + timeout);
        }
    }

    /**
     * Query every 30s for up to 30 minutes.
     */
    public static PollConfig defaults() {
        return new PollConfig(DEFAULT_INTERVAL, DEFAULT_TIMEOUT);
    }

    public static PollConfig of(Duration interval, Duration timeout) {
        return new PollConfig(interval, timeout);
    }

    public PollConfig withTimeout(Duration timeout) {
        return new PollConfig(interval, timeout);
    }
}
