package org.javai.jobguard;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Unchecked: callers that want to handle aborts inspect the {@link Outcome} instead.
 */
public class OperationAbortedException extends RuntimeException {

    private final Failure failure;

    public OperationAbortedException(Failure failure) {
        super(failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
