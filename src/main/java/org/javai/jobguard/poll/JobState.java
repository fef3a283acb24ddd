package org.javai.jobguard.poll;

import java.util.Locale;
import java.util.Objects;

/**
 * Lifecycle state of an asynchronous remote job.
 *
 * <p>{@link #PENDING} and {@link #RUNNING} are non-terminal. {@link #COMPLETED} is the only
 * terminal success; {@link #FAILED}, {@link #ABORTED} and {@link #EXPIRED} are terminal failures.
 */
public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    ABORTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean isSuccess() {
        return this == COMPLETED;
    }

    public boolean isFailure() {
        return this == FAILED || this == ABORTED || this == EXPIRED;
    }

    /**
     * Maps a provider status string, ignoring case.
     * {@code CREATED} counts as pending, {@code ABORTING} as still running and {@code PARTIAL}
     * (some resources not backed up) as failed.
     *
     * @throws IllegalArgumentException for a status this library does not know
     */
    public static JobState fromProviderStatus(String status) {
        Objects.requireNonNull(status, "status must not be null");
        switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "CREATED":
            case "PENDING":
                return PENDING;
            case "RUNNING":
            case "ABORTING":
                return RUNNING;
            case "COMPLETED":
                return COMPLETED;
            case "FAILED":
            case "PARTIAL":
                return FAILED;
            case "ABORTED":
                return ABORTED;
            case "EXPIRED":
                return EXPIRED;
            default:
                throw new IllegalArgumentException("Unknown job status: " + status);
        }
    }
}
