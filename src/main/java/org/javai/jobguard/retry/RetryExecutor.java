package org.javai.jobguard.retry;

import org.javai.jobguard.AttemptOutcome;
import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.FailureCode;
import org.javai.jobguard.FailureType;
import org.javai.jobguard.Outcome;
import org.javai.jobguard.classify.Boundary;
import org.javai.jobguard.classify.ErrorClassifier;
import org.javai.jobguard.classify.ThrowingSupplier;
import org.javai.jobguard.ops.OpReporter;
import org.javai.jobguard.ops.log4j.Log4jOpReporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Invokes an idempotent remote call until it succeeds, fails fatally, or runs out of attempts.
 * Operates entirely over values: failures come back as {@link Outcome.Fail}, never as exceptions.
 *
 * <p>Per attempt:
 * <ol>
 *   <li>success returns immediately, without delay;</li>
 *   <li>a fatal error aborts at once, leaving the remaining budget unused;</li>
 *   <li>an interrupted call aborts at once as {@link FailureType#CANCELLED};</li>
 *   <li>a retryable error on the last permitted attempt ends the loop without sleeping;</li>
 *   <li>any other retryable error is reported, then the thread sleeps for
 *       {@link BackoffPolicy#delayForAttempt(int, RetryConfig)} before the next attempt.</li>
 * </ol>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * Outcome<String> jobId = executor.execute(
 *     "start backup job for EBS",
 *     RetryConfig.defaults(),
 *     () -> backupClient.startBackupJob(request).backupJobId()
 * );
 * }</pre>
 */
public final class RetryExecutor {

    private final Boundary boundary;
    private final BackoffPolicy backoff;
    private final OpReporter reporter;
    private final Sleeper sleeper;
    private final Clock clock;

    private RetryExecutor(Boundary boundary, BackoffPolicy backoff, OpReporter reporter, Sleeper sleeper, Clock clock) {
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a builder for configuring a RetryExecutor instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a RetryExecutor instance.
     *
     * <p>Every setting is optional: default vocabulary classification, exponential backoff,
     * no reporting, plain thread sleep and the system clock.</p>
     */
    public static final class Builder {
        private ErrorClassifier classifier = ErrorClassifier.defaults();
        private BackoffPolicy backoff = BackoffPolicy.exponential();
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = Sleeper.threadSleep();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the classifier that separates retryable from fatal errors.
         *
         * @param classifier the error classifier
         * @return this builder
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the backoff policy.
         *
         * @param backoff the policy computing delays between attempts
         * @return this builder
         */
        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry and abort events.
         *
         * @param reporter the reporter
         * @return this builder
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets how the executor waits between attempts.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Makes every wait abort early when the signal is cancelled.
         *
         * @param signal the cancellation signal
         * @return this builder
         */
        public Builder cancellation(CancellationSignal signal) {
            return sleeper(Sleeper.cancellable(signal));
        }

        /**
         * Sets the clock used to measure elapsed time and to stamp failures.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(new Boundary(classifier), backoff, reporter, sleeper, clock);
        }
    }

    /**
     * Invokes a remote call with retry. Anything the call throws is classified by the
     * configured {@link ErrorClassifier}.
     *
     * @param description Human-readable description of the operation, used in messages and reports
     * @param config The retry settings for this call
     * @param operation The idempotent call
     * @return Ok with the call's result, or Fail describing why the executor gave up
     */
    public <T> Outcome<T> execute(
            String description,
            RetryConfig config,
            ThrowingSupplier<T, ? extends Exception> operation
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        return executeAttempts(description, config, () -> boundary.attempt(operation));
    }

    /**
     * Runs the retry loop over an operation that classifies its own result.
     *
     * @param description Human-readable description of the operation
     * @param config The retry settings for this call
     * @param attempt Performs one invocation and returns its classified result
     * @return Ok with the successful value, or Fail describing why the executor gave up
     */
    public <T> Outcome<T> executeAttempts(
            String description,
            RetryConfig config,
            Supplier<AttemptOutcome<T>> attempt
    ) {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryContext context = RetryContext.first(clock.instant());

        while (true) {
            AttemptOutcome<T> result = Objects.requireNonNull(attempt.get(), "attempt returned null");

            if (result instanceof AttemptOutcome.Success<T> success) {
                return Outcome.ok(success.value());
            }

            RetryDecision decision = decide(context, config, result);

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                return abort(giveUp.type(), description, config, context, result);
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            reporter.reportRetryAttempt(description, context.attemptNumber(), config.maxAttempts(),
                    delay, causeOf(result));
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                if (!(e instanceof WaitCancelledException)) {
                    Thread.currentThread().interrupt();
                }
                return abort(FailureType.CANCELLED, description, config, context, result);
            }
            context = context.next();
        }
    }

    private RetryDecision decide(RetryContext context, RetryConfig config, AttemptOutcome<?> result) {
        if (result instanceof AttemptOutcome.FatalFailure<?> fatal) {
            return new RetryDecision.GiveUp(
                    fatal.exception() instanceof InterruptedException ? FailureType.CANCELLED : FailureType.FATAL);
        }
        if (context.isLastAttempt(config)) {
            return new RetryDecision.GiveUp(FailureType.EXHAUSTED);
        }
        return new RetryDecision.Retry(backoff.delayForAttempt(context.attemptIndex(), config));
    }

    private <T> Outcome<T> abort(
            FailureType type,
            String description,
            RetryConfig config,
            RetryContext context,
            AttemptOutcome<T> last
    ) {
        Instant now = clock.instant();
        Cause cause = causeOf(last);
        String message = switch (type) {
            case FATAL -> description + " failed with non-retryable error: " + cause;
            case EXHAUSTED -> description + " failed after " + config.maxAttempts() + " attempts: " + cause;
            case CANCELLED -> last instanceof AttemptOutcome.FatalFailure
                    ? description + " interrupted during attempt " + context.attemptNumber() + ": " + cause
                    : description + " cancelled after " + context.attemptNumber()
                            + " attempts while waiting to retry: " + cause;
            default -> throw new IllegalStateException("Unexpected abort type: " + type);
        };

        Failure failure = Failure.builder(codeOf(last), message, type, description)
                .attempts(context.attemptNumber())
                .elapsed(context.elapsedAt(now))
                .cause(cause)
                .exception(exceptionOf(last))
                .occurredAt(now)
                .build();

        reporter.report(failure);
        return Outcome.fail(failure);
    }

    private static Cause causeOf(AttemptOutcome<?> result) {
        if (result instanceof AttemptOutcome.RetryableFailure<?> retryable) {
            return retryable.cause();
        }
        return ((AttemptOutcome.FatalFailure<?>) result).cause();
    }

    private static FailureCode codeOf(AttemptOutcome<?> result) {
        if (result instanceof AttemptOutcome.RetryableFailure<?> retryable) {
            return retryable.code();
        }
        return ((AttemptOutcome.FatalFailure<?>) result).code();
    }

    private static Throwable exceptionOf(AttemptOutcome<?> result) {
        if (result instanceof AttemptOutcome.RetryableFailure<?> retryable) {
            return retryable.exception();
        }
        return ((AttemptOutcome.FatalFailure<?>) result).exception();
    }

    // === STATIC CONVENIENCE ===

    /**
     * Invokes a remote call with {@link RetryConfig#defaults()}, the default vocabulary and
     * log4j reporting.
     *
     * @param description Human-readable description of the operation
     * @param operation The idempotent call
     * @return the final Outcome after success or giving up
     */
    public static <T> Outcome<T> attempt(String description, ThrowingSupplier<T, ? extends Exception> operation) {
        RetryExecutor executor = RetryExecutor.builder()
                .reporter(new Log4jOpReporter())
                .build();
        return executor.execute(description, RetryConfig.defaults(), operation);
    }
}
