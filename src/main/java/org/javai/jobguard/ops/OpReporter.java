package org.javai.jobguard.ops;

import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.poll.JobHandle;
import org.javai.jobguard.poll.JobStatus;

import java.time.Duration;

/**
 * Receives progress and abort events from retry loops, pollers and sequences.
 * Implementations might write structured logs, emit metrics, or collect events in tests.
 *
 * <p>Only {@link #report(Failure)} is mandatory; the other events default to no-ops.
 */
public interface OpReporter {

    /**
     * Reports an abort: a fatal error, exhausted attempts, a failed job, a poll timeout
     * or a cancellation.
     */
    void report(Failure failure);

    /**
     * Reports that an attempt failed with a retryable error and another attempt will follow.
     *
     * @param operation The description of the operation
     * @param attemptNumber The attempt that just failed (1-based)
     * @param maxAttempts The total attempt budget
     * @param delay How long the executor will wait before the next attempt
     * @param cause Why the attempt failed
     */
    default void reportRetryAttempt(String operation, int attemptNumber, int maxAttempts, Duration delay, Cause cause) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports the state observed by one status query of a polled job.
     *
     * @param handle The job being polled
     * @param status What the query returned
     * @param pollNumber The query count so far (1-based)
     * @param elapsed Time since polling started
     */
    default void reportJobState(JobHandle handle, JobStatus status, int pollNumber, Duration elapsed) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a sequence phase is about to run.
     */
    default void reportPhaseStarted(String sequence, int phaseIndex, String phase) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a sequence phase returned successfully.
     */
    default void reportPhaseCompleted(String sequence, int phaseIndex, String phase, Duration elapsed) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
