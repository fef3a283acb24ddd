package org.javai.jobguard.poll;

import org.javai.jobguard.Failure;
import org.javai.jobguard.FailureType;
import org.javai.jobguard.Outcome;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * How polling a job ended: {@link Completed}, {@link Failed} or {@link TimedOut}.
 * Every variant records how many status queries were made and how long polling took.
 */
public sealed interface PollResult permits PollResult.Completed, PollResult.Failed, PollResult.TimedOut {

    JobHandle handle();

    int polls();

    Duration elapsed();

    /**
     * Converts to an {@link Outcome}: Completed becomes Ok, the others become Fail with
     * {@link FailureType#JOB_FAILED}, {@link FailureType#TIMED_OUT}, or the type of the failure
     * that stopped polling.
     */
    Outcome<Completed> toOutcome();

    /**
     * The job reached {@link JobState#COMPLETED}.
     *
     * @param artifactReference what the job produced, if the query exposed it
     */
    record Completed(JobHandle handle, Optional<String> artifactReference, int polls, Duration elapsed)
            implements PollResult {

        public Completed {
            Objects.requireNonNull(handle, "handle must not be null");
            Objects.requireNonNull(artifactReference, "artifactReference must not be null, use Optional.empty()");
            Objects.requireNonNull(elapsed, "elapsed must not be null");
        }

        @Override
        public Outcome<Completed> toOutcome() {
            return Outcome.ok(this);
        }
    }

    /**
     * Polling stopped without success: the job reached a terminal failure state, the status
     * query itself could not be completed, or the wait was cancelled.
     *
     * @param state the terminal failure state, or empty if the job's state is unknown
     * @param failure the abort, whose message is the human-readable reason
     */
    record Failed(JobHandle handle, Optional<JobState> state, int polls, Duration elapsed, Failure failure)
            implements PollResult {

        public Failed {
            Objects.requireNonNull(handle, "handle must not be null");
            Objects.requireNonNull(state, "state must not be null, use Optional.empty()");
            Objects.requireNonNull(elapsed, "elapsed must not be null");
            Objects.requireNonNull(failure, "failure must not be null");
        }

        public String reason() {
            return failure.message();
        }

        @Override
        public Outcome<Completed> toOutcome() {
            return Outcome.fail(failure);
        }
    }

    /**
     * The timeout expired while the job was still pending or running. The job's outcome is
     * unknown, not failed.
     *
     * @param lastState the last observed state, empty if no query succeeded
     * @param timeout the budget that expired
     * @param failure the abort describing this timeout
     */
    record TimedOut(JobHandle handle, Optional<JobState> lastState, int polls, Duration elapsed, Duration timeout,
                    Failure failure) implements PollResult {

        public TimedOut {
            Objects.requireNonNull(handle, "handle must not be null");
            Objects.requireNonNull(lastState, "lastState must not be null, use Optional.empty()");
            Objects.requireNonNull(elapsed, "elapsed must not be null");
            Objects.requireNonNull(timeout, "timeout must not be null");
            Objects.requireNonNull(failure, "failure must not be null");
        }

        public String reason() {
            return failure.message();
        }

        @Override
        public Outcome<Completed> toOutcome() {
            return Outcome.fail(failure);
        }
    }
}
