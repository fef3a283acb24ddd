package org.javai.jobguard.poll;

import java.util.Objects;
import java.util.Optional;

/**
 * One answer of a job status query.
 *
 * @param state The job's current state
 * @param artifactReference What the job produced, once completed (recovery point, restored resource)
 * @param statusMessage The provider's explanation, if any
 */
public record JobStatus(JobState state, Optional<String> artifactReference, Optional<String> statusMessage) {

    public JobStatus {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(artifactReference, "artifactReference must not be null, use Optional.empty()");
        Objects.requireNonNull(statusMessage, "statusMessage must not be null, use Optional.empty()");
    }

    public static JobStatus of(JobState state) {
        return new JobStatus(state, Optional.empty(), Optional.empty());
    }

    public static JobStatus completed(String artifactReference) {
        return new JobStatus(JobState.COMPLETED, Optional.ofNullable(artifactReference), Optional.empty());
    }

    public static JobStatus failed(JobState state, String statusMessage) {
        return new JobStatus(state, Optional.empty(), Optional.ofNullable(statusMessage));
    }
}
