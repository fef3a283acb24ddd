package org.javai.jobguard.poll;

/**
 * Asks the provider for the current state of a job. A remote call: it may fail transiently,
 * so {@link JobPoller} runs every query through a {@link org.javai.jobguard.retry.RetryExecutor}.
 */
@FunctionalInterface
public interface JobStatusQuery {

    JobStatus query(JobHandle handle) throws Exception;
}
