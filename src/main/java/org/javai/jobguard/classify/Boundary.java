package org.javai.jobguard.classify;

import org.javai.jobguard.AttemptOutcome;
import org.javai.jobguard.Cause;
import org.javai.jobguard.FailureCode;
import org.javai.jobguard.retry.WaitCancelledException;

import java.util.Objects;

/**
 * The boundary adapter around remote calls. Invokes the call once, catches whatever it throws,
 * classifies it and returns an {@link AttemptOutcome}.
 *
 * <p>This is the single point where exceptions thrown by a cloud SDK are translated into
 * classified attempt results. Unlike a general-purpose boundary, unchecked exceptions are caught
 * too: provider SDKs report throttling and service errors as runtime exceptions. {@link Error}s
 * are never caught. An {@link InterruptedException} is not classified: the interrupt flag is
 * restored and the attempt fails with {@link #INTERRUPTED}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withDefaults();
 *
 * AttemptOutcome<String> result = boundary.attempt(
 *     () -> backupClient.startBackupJob(request).backupJobId()
 * );
 * }</pre>
 */
public final class Boundary {

    /**
     * Code carried by the fatal failure of an interrupted call.
     */
    public static final FailureCode INTERRUPTED = FailureCode.of("cancelled", "interrupted");

    private final ErrorClassifier classifier;

    /**
     * Creates a Boundary using the default cloud vocabulary.
     *
     * @return a Boundary backed by {@link ErrorClassifier#defaults()}
     */
    public static Boundary withDefaults() {
        return new Boundary(ErrorClassifier.defaults());
    }

    public static Boundary of(ErrorClassifier classifier) {
        return new Boundary(classifier);
    }

    public Boundary(ErrorClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Executes one invocation of a remote call.
     *
     * @param work The call to make
     * @return Success with the result, or a retryable or fatal failure according to the classifier
     */
    public <T> AttemptOutcome<T> attempt(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        @SuppressWarnings("unchecked")
        ThrowingSupplier<T, Exception> call = (ThrowingSupplier<T, Exception>) work;

        try {
            return AttemptOutcome.success(call.get());
        } catch (InterruptedException e) {
            return interrupted(e);
        } catch (Exception e) {
            return classified(e);
        }
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    private <T> AttemptOutcome<T> classified(Exception e) {
        Classification classification = classifier.classify(e);
        Cause cause = Cause.of(e.getClass().getName(), describe(e));
        if (classification.isRetryable()) {
            return new AttemptOutcome.RetryableFailure<>(classification.code(), cause, e);
        }
        return new AttemptOutcome.FatalFailure<>(classification.code(), cause, e);
    }

    /**
     * An interrupted call is never retried and never classified; the interrupt flag is restored
     * unless the interruption came from a cancellation signal.
     */
    private static <T> AttemptOutcome<T> interrupted(InterruptedException e) {
        if (!(e instanceof WaitCancelledException)) {
            Thread.currentThread().interrupt();
        }
        return new AttemptOutcome.FatalFailure<>(INTERRUPTED, Cause.of(e.getClass().getName(), describe(e)), e);
    }

    private static String describe(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        if (e instanceof ProviderError providerError && providerError.errorCode() != null) {
            return providerError.errorCode() + ": " + message;
        }
        return message;
    }
}
