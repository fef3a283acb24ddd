package org.javai.jobguard.retry;

/**
 * Thrown by a {@link Sleeper#cancellable(CancellationSignal) cancellable sleeper} when its signal
 * fires. Unlike a thread interrupt, the thread's interrupt status is not involved.
 */
public class WaitCancelledException extends InterruptedException {

    public WaitCancelledException(String reason) {
        super(reason);
    }
}
