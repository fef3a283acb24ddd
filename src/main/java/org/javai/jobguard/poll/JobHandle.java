package org.javai.jobguard.poll;

import java.util.Objects;

/**
 * Identifies an asynchronous remote job and the kind of resource it targets.
 *
 * @param jobId The provider's job identifier
 * @param resourceType What the job works on (e.g., "EBS", "DynamoDB", "restore")
 */
public record JobHandle(String jobId, String resourceType) {

    public JobHandle {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(resourceType, "resourceType must not be null");
        if (jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
    }

    public static JobHandle of(String jobId, String resourceType) {
        return new JobHandle(jobId, resourceType);
    }

    @Override
    public String toString() {
        return resourceType + " job " + jobId;
    }
}
