package org.javai.jobguard;

/**
 * Classifies why a guarded operation was aborted.
 */
public enum FailureType {
    /**
     * The remote call failed with an error that retrying will not fix.
     * Examples: validation error, access denied.
     */
    FATAL,

    /**
     * Every permitted attempt failed with a retryable error.
     * The last observed cause is attached.
     */
    EXHAUSTED,

    /**
     * A polled job reached a terminal failure state (failed, aborted, expired).
     * The job's own outcome is never retried.
     */
    JOB_FAILED,

    /**
     * Polling ran out of wall-clock time before the job reached a terminal state.
     * The job's outcome is unknown, not failed.
     */
    TIMED_OUT,

    /**
     * A wait was cancelled by an external signal or a thread interrupt.
     */
    CANCELLED
}
