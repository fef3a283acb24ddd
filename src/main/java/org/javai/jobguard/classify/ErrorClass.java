package org.javai.jobguard.classify;

/**
 * Whether retrying a failed remote call may help.
 */
public enum ErrorClass {
    /**
     * Transient: throttling, brief unavailability, connectivity, timeouts, conflicts.
     */
    RETRYABLE,

    /**
     * Permanent: validation errors, authorization denials, anything unrecognised.
     */
    FATAL
}
