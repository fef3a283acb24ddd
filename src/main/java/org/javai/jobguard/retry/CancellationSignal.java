package org.javai.jobguard.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A one-shot signal shared between a controller and any number of waiting retry or poll loops.
 * Once cancelled it stays cancelled.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationSignal signal = new CancellationSignal();
 * RetryExecutor executor = RetryExecutor.builder()
 *     .sleeper(Sleeper.cancellable(signal))
 *     .build();
 *
 * // elsewhere, e.g. when a suite-wide deadline passes
 * signal.cancel("suite deadline reached");
 * }</pre>
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Cancels every current and future wait on this signal. Only the first reason is kept.
     */
    public void cancel(String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        if (this.reason.compareAndSet(null, reason)) {
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * The reason given to {@link #cancel(String)}, or null while not cancelled.
     */
    public String reason() {
        return reason.get();
    }

    /**
     * Waits for up to the given duration.
     *
     * @return true if the signal was (or already had been) cancelled, false if the full
     *         duration elapsed
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
