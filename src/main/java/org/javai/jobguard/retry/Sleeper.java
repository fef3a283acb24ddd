package org.javai.jobguard.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Suspends the calling thread between attempts and between polls.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks for the given duration. Zero and negative durations return immediately.
     *
     * @throws InterruptedException if the thread is interrupted, or a
     *         {@link WaitCancelledException} if a cancellation signal fires mid-wait
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * A plain timed sleep.
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        };
    }

    /**
     * A wait that ends early when the signal is cancelled, so an external deadline can
     * abort a retry or poll loop mid-delay.
     */
    static Sleeper cancellable(CancellationSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        return duration -> {
            if (signal.await(duration)) {
                throw new WaitCancelledException(signal.reason());
            }
        };
    }
}
