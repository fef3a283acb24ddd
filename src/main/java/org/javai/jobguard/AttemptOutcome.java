package org.javai.jobguard;

import java.util.Objects;

/**
 * The classified result of a single invocation of a remote operation.
 *
 * <p>Produced by {@link org.javai.jobguard.classify.Boundary} (or directly by operations that
 * classify themselves) and consumed by {@link org.javai.jobguard.retry.RetryExecutor} within one
 * attempt. Never stored beyond the call that produced it.
 *
 * @param <T> The type of the successful value
 */
public sealed interface AttemptOutcome<T>
        permits AttemptOutcome.Success, AttemptOutcome.RetryableFailure, AttemptOutcome.FatalFailure {

    /**
     * The invocation succeeded.
     */
    record Success<T>(T value) implements AttemptOutcome<T> {
    }

    /**
     * The invocation failed with an error presumed to resolve with time.
     *
     * @param code identifies what made the error retryable
     * @param cause the error, for diagnostics
     * @param exception the underlying exception (may be null)
     */
    record RetryableFailure<T>(FailureCode code, Cause cause, Throwable exception) implements AttemptOutcome<T> {
        public RetryableFailure {
            Objects.requireNonNull(code, "code must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
        }
    }

    /**
     * The invocation failed with an error that retrying will not fix.
     *
     * @param code identifies the error
     * @param cause the error, for diagnostics
     * @param exception the underlying exception (may be null)
     */
    record FatalFailure<T>(FailureCode code, Cause cause, Throwable exception) implements AttemptOutcome<T> {
        public FatalFailure {
            Objects.requireNonNull(code, "code must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
        }
    }

    static <T> AttemptOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> AttemptOutcome<T> retryable(FailureCode code, String detail) {
        return new RetryableFailure<>(code, Cause.of(code.toString(), detail), null);
    }

    static <T> AttemptOutcome<T> fatal(FailureCode code, String detail) {
        return new FatalFailure<>(code, Cause.of(code.toString(), detail), null);
    }
}
