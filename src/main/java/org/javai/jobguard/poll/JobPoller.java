package org.javai.jobguard.poll;

import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.FailureCode;
import org.javai.jobguard.FailureType;
import org.javai.jobguard.Outcome;
import org.javai.jobguard.ops.OpReporter;
import org.javai.jobguard.retry.RetryConfig;
import org.javai.jobguard.retry.RetryExecutor;
import org.javai.jobguard.retry.Sleeper;
import org.javai.jobguard.retry.WaitCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Polls an asynchronous job until it reaches a terminal state or a wall-clock timeout expires.
 *
 * <p>One poller serves one kind of job: build one with the backup-job status query and another
 * with the restore-job status query; the state machine is the same.</p>
 *
 * <p>Each loop iteration queries the status (through the {@link RetryExecutor}, since the query
 * is itself a remote call), then:
 * <ul>
 *   <li>{@link JobState#COMPLETED} returns {@link PollResult.Completed} with the artifact reference;</li>
 *   <li>{@link JobState#FAILED}, {@link JobState#ABORTED} or {@link JobState#EXPIRED} returns
 *       {@link PollResult.Failed} immediately, never retried;</li>
 *   <li>anything else sleeps for the fixed interval and loops.</li>
 * </ul>
 * The loop runs while elapsed time is below the timeout; the query in flight at the boundary is
 * allowed to finish, so polling overruns the timeout by at most one interval.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * JobPoller backupPoller = JobPoller.builder(handle -> describeBackupJob(handle.jobId()))
 *     .executor(executor)
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * PollResult result = backupPoller.pollUntilTerminal(
 *     JobHandle.of(jobId, "EBS"), Duration.ofSeconds(30), Duration.ofMinutes(30));
 * }</pre>
 */
public final class JobPoller {

    private final JobStatusQuery query;
    private final RetryExecutor executor;
    private final RetryConfig queryRetry;
    private final OpReporter reporter;
    private final Sleeper sleeper;
    private final Clock clock;

    private JobPoller(Builder builder) {
        this.query = builder.query;
        this.executor = builder.executor;
        this.queryRetry = builder.queryRetry;
        this.reporter = builder.reporter;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
    }

    /**
     * Creates a builder for a poller of the jobs answered by the given query.
     *
     * @param query asks the provider for a job's current status
     * @return a new builder
     */
    public static Builder builder(JobStatusQuery query) {
        return new Builder(query);
    }

    /**
     * Builder for a JobPoller. Only the status query is required.
     */
    public static final class Builder {
        private final JobStatusQuery query;
        private RetryExecutor executor;
        private RetryConfig queryRetry = RetryConfig.defaults();
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = Sleeper.threadSleep();
        private Clock clock = Clock.systemUTC();

        private Builder(JobStatusQuery query) {
            this.query = Objects.requireNonNull(query, "query must not be null");
        }

        /**
         * Sets the executor that retries failed status queries
         * (defaults to one with the default vocabulary and this poller's reporter, sleeper and clock).
         */
        public Builder executor(RetryExecutor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * Sets the retry settings applied to each status query.
         */
        public Builder queryRetry(RetryConfig queryRetry) {
            this.queryRetry = Objects.requireNonNull(queryRetry, "queryRetry must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets how the poller waits between queries.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the clock used to measure elapsed time (package-private, for tests).
         */
        Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public JobPoller build() {
            if (executor == null) {
                executor = RetryExecutor.builder()
                        .reporter(reporter)
                        .sleeper(sleeper)
                        .clock(clock)
                        .build();
            }
            return new JobPoller(this);
        }
    }

    /**
     * Polls using the interval and timeout of the given config.
     */
    public PollResult pollUntilTerminal(JobHandle handle, PollConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return pollUntilTerminal(handle, config.interval(), config.timeout());
    }

    /**
     * Polls the job until it reaches a terminal state or the timeout expires.
     *
     * @param handle The job to poll
     * @param pollInterval Fixed wait between queries
     * @param timeout Wall-clock budget for reaching a terminal state
     * @return Completed, Failed or TimedOut; never throws for an operational failure
     */
    public PollResult pollUntilTerminal(JobHandle handle, Duration pollInterval, Duration timeout) {
        Objects.requireNonNull(handle, "handle must not be null");
        PollConfig config = PollConfig.of(pollInterval, timeout);

        Instant start = clock.instant();
        int polls = 0;
        Optional<JobState> lastState = Optional.empty();

        while (elapsedSince(start).compareTo(config.timeout()) < 0) {
            Outcome<JobStatus> queried = executor.execute(
                    "describe " + handle,
                    queryRetry,
                    () -> Objects.requireNonNull(query.query(handle), "status query returned null"));
            polls++;

            if (queried instanceof Outcome.Fail<JobStatus> fail) {
                return queryFailed(handle, polls, elapsedSince(start), fail.failure());
            }

            JobStatus status = queried.getOrThrow();
            lastState = Optional.of(status.state());
            reporter.reportJobState(handle, status, polls, elapsedSince(start));

            if (status.state().isSuccess()) {
                return new PollResult.Completed(handle, status.artifactReference(), polls, elapsedSince(start));
            }
            if (status.state().isFailure()) {
                return jobFailed(handle, status, polls, elapsedSince(start));
            }

            try {
                sleeper.sleep(config.interval());
            } catch (InterruptedException e) {
                if (!(e instanceof WaitCancelledException)) {
                    Thread.currentThread().interrupt();
                }
                return cancelled(handle, lastState, polls, elapsedSince(start), e);
            }
        }

        return timedOut(handle, lastState, polls, elapsedSince(start), config.timeout());
    }

    private PollResult timedOut(JobHandle handle, Optional<JobState> lastState, int polls, Duration elapsed,
                                Duration timeout) {
        String state = lastState.map(Enum::name).orElse("unknown");
        Failure failure = Failure.builder(
                        FailureCode.of("job", "timed_out"),
                        handle + " did not complete within " + timeout + " (" + polls + " polls, last state "
                                + state + ")",
                        FailureType.TIMED_OUT,
                        "poll " + handle)
                .attempts(polls)
                .elapsed(elapsed)
                .cause(Cause.of("JobState", state))
                .occurredAt(clock.instant())
                .tags(tagsFor(handle, lastState))
                .build();

        reporter.report(failure);
        return new PollResult.TimedOut(handle, lastState, polls, elapsed, timeout, failure);
    }

    private PollResult jobFailed(JobHandle handle, JobStatus status, int polls, Duration elapsed) {
        JobState state = status.state();
        String message = handle + " ended in state " + state + " after " + polls + " polls (" + elapsed + ")"
                + status.statusMessage().map(m -> ": " + m).orElse("");

        Failure failure = Failure.builder(
                        FailureCode.of("job", state.name().toLowerCase(Locale.ROOT)),
                        message,
                        FailureType.JOB_FAILED,
                        "poll " + handle)
                .attempts(polls)
                .elapsed(elapsed)
                .cause(Cause.of("JobState", state.name()))
                .occurredAt(clock.instant())
                .tags(tagsFor(handle, Optional.of(state)))
                .build();

        reporter.report(failure);
        return new PollResult.Failed(handle, Optional.of(state), polls, elapsed, failure);
    }

    private PollResult queryFailed(JobHandle handle, int polls, Duration elapsed, Failure queryFailure) {
        // The executor has already reported the query failure itself.
        Failure failure = queryFailure.withContext(
                handle + " status query failed after " + polls + " polls (" + elapsed + "): "
                        + queryFailure.message(),
                tagsFor(handle, Optional.empty()));
        return new PollResult.Failed(handle, Optional.empty(), polls, elapsed, failure);
    }

    private PollResult cancelled(JobHandle handle, Optional<JobState> lastState, int polls, Duration elapsed,
                                 InterruptedException e) {
        Failure failure = Failure.builder(
                        FailureCode.of("job", "cancelled"),
                        handle + " polling cancelled after " + elapsed + " (" + polls + " polls, last state "
                                + lastState.map(Enum::name).orElse("unknown") + ")",
                        FailureType.CANCELLED,
                        "poll " + handle)
                .attempts(polls)
                .elapsed(elapsed)
                .cause(Cause.fromThrowable(e))
                .exception(e)
                .occurredAt(clock.instant())
                .tags(tagsFor(handle, lastState))
                .build();

        reporter.report(failure);
        return new PollResult.Failed(handle, Optional.empty(), polls, elapsed, failure);
    }

    private static Map<String, String> tagsFor(JobHandle handle, Optional<JobState> state) {
        Map<String, String> tags = new HashMap<>();
        tags.put("jobId", handle.jobId());
        tags.put("resourceType", handle.resourceType());
        state.ifPresent(s -> tags.put("jobState", s.name()));
        return tags;
    }

    private Duration elapsedSince(Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
