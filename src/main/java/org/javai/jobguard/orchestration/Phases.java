package org.javai.jobguard.orchestration;

import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.FailureCode;
import org.javai.jobguard.FailureType;
import org.javai.jobguard.Outcome;
import org.javai.jobguard.poll.JobHandle;
import org.javai.jobguard.poll.JobPoller;
import org.javai.jobguard.poll.PollConfig;
import org.javai.jobguard.poll.PollResult;
import org.javai.jobguard.retry.RetryConfig;
import org.javai.jobguard.retry.RetryExecutor;

import java.util.Map;
import java.util.Objects;

/**
 * Phases built from the two primitives: a retried remote call and a job poll.
 *
 * <pre>{@code
 * OrchestrationSequence<String, String> backupThenRestore = OrchestrationSequence.<String>begin("ebs backup/restore")
 *     .then(Phases.retrying("start backup job", executor, retry, volumeArn -> startBackup(volumeArn)))
 *     .then(Phases.awaitArtifact("await backup", backupPoller, poll))
 *     .then(Phases.retrying("start restore job", executor, retry, recoveryPoint -> startRestore(recoveryPoint)))
 *     .then(Phases.awaitArtifact("await restore", restorePoller, poll))
 *     .build();
 * }</pre>
 */
public final class Phases {

    private Phases() {
        // Utility class
    }

    /**
     * A phase that runs an idempotent remote call through the executor.
     */
    public static <I, O> Phase<I, O> retrying(
            String description,
            RetryExecutor executor,
            RetryConfig config,
            ThrowingFunction<? super I, ? extends O, ? extends Exception> call
    ) {
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(call, "call must not be null");
        return Phase.of(description, input -> executor.<O>execute(description, config, () -> call.apply(input)));
    }

    /**
     * A phase that polls the job it receives until it is terminal. Completed becomes Ok; a failed
     * job, a query failure or a timeout becomes Fail.
     */
    public static Phase<JobHandle, PollResult.Completed> polling(String name, JobPoller poller, PollConfig config) {
        Objects.requireNonNull(poller, "poller must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return Phase.of(name, handle -> poller.pollUntilTerminal(handle, config).toOutcome());
    }

    /**
     * Like {@link #polling}, but yields the completed job's artifact reference. A job that
     * completes without exposing one fails the phase.
     */
    public static Phase<JobHandle, String> awaitArtifact(String name, JobPoller poller, PollConfig config) {
        Phase<JobHandle, PollResult.Completed> polling = polling(name, poller, config);
        return Phase.of(name, handle -> polling.run(handle).flatMap(Phases::artifactOf));
    }

    private static Outcome<String> artifactOf(PollResult.Completed completed) {
        if (completed.artifactReference().isPresent()) {
            return Outcome.ok(completed.artifactReference().get());
        }
        JobHandle handle = completed.handle();
        return Outcome.fail(Failure.builder(
                        FailureCode.of("job", "no_artifact"),
                        handle + " completed after " + completed.polls() + " polls without an artifact reference",
                        FailureType.JOB_FAILED,
                        "poll " + handle)
                .attempts(completed.polls())
                .elapsed(completed.elapsed())
                .cause(Cause.of("JobState", "COMPLETED"))
                .tags(Map.of("jobId", handle.jobId(), "resourceType", handle.resourceType(), "jobState", "COMPLETED"))
                .build());
    }
}
