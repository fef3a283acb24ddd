package org.javai.jobguard.classify;

import org.javai.jobguard.AttemptOutcome;
import org.javai.jobguard.FailureCode;
import org.javai.jobguard.retry.WaitCancelledException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;

class BoundaryTest {

    private final Boundary boundary = Boundary.withDefaults();

    @Test
    void attempt_success_returnsSuccess() {
        AttemptOutcome<String> result = boundary.attempt(() -> "recovery-point-1");

        assertThat(result).isEqualTo(AttemptOutcome.success("recovery-point-1"));
    }

    @Test
    void attempt_checkedTransientException_isRetryable() {
        AttemptOutcome<String> result = boundary.attempt(() -> {
            throw new SocketTimeoutException("Read timed out");
        });

        assertThat(result).isInstanceOf(AttemptOutcome.RetryableFailure.class);
        AttemptOutcome.RetryableFailure<String> retryable = (AttemptOutcome.RetryableFailure<String>) result;
        assertThat(retryable.cause().type()).isEqualTo(SocketTimeoutException.class.getName());
        assertThat(retryable.cause().detail()).isEqualTo("Read timed out");
        assertThat(retryable.exception()).isInstanceOf(SocketTimeoutException.class);
    }

    @Test
    void attempt_interrupted_isFatalAndRestoresInterruptFlag() {
        try {
            AttemptOutcome<String> result = boundary.attempt(() -> {
                throw new InterruptedException("connection timed out");
            });

            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(result).isInstanceOf(AttemptOutcome.FatalFailure.class);
            assertThat(((AttemptOutcome.FatalFailure<String>) result).code()).isEqualTo(Boundary.INTERRUPTED);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void attempt_waitCancelled_leavesInterruptFlagClear() {
        AttemptOutcome<String> result = boundary.attempt(() -> {
            throw new WaitCancelledException("suite deadline reached");
        });

        assertThat(Thread.currentThread().isInterrupted()).isFalse();
        assertThat(((AttemptOutcome.FatalFailure<String>) result).code()).isEqualTo(Boundary.INTERRUPTED);
    }

    @Test
    void attempt_uncheckedProviderException_isCaughtAndClassified() {
        AttemptOutcome<String> result = boundary.attempt(() -> {
            throw new ProviderException("ThrottlingException", "Rate exceeded");
        });

        AttemptOutcome.RetryableFailure<String> retryable = (AttemptOutcome.RetryableFailure<String>) result;
        assertThat(retryable.code()).isEqualTo(FailureCode.of("provider", "ThrottlingException"));
        assertThat(retryable.cause().detail()).isEqualTo("ThrottlingException: Rate exceeded");
    }

    @Test
    void attempt_permanentException_isFatal() {
        AttemptOutcome<String> result = boundary.attempt(() -> {
            throw new IOException("file is corrupt");
        });

        assertThat(result).isInstanceOf(AttemptOutcome.FatalFailure.class);
    }

    @Test
    void attempt_exceptionWithoutMessage_usesClassName() {
        AttemptOutcome<String> result = boundary.attempt(() -> {
            throw new IllegalStateException();
        });

        AttemptOutcome.FatalFailure<String> fatal = (AttemptOutcome.FatalFailure<String>) result;
        assertThat(fatal.cause().detail()).isEqualTo(IllegalStateException.class.getName());
    }

    @Test
    void attempt_errorsPropagate() {
        assertThatThrownBy(() -> boundary.attempt(() -> {
            throw new OutOfMemoryError("heap");
        })).isInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void customClassifier_isUsed() {
        Boundary everythingRetryable = Boundary.of(error ->
                new Classification(ErrorClass.RETRYABLE, FailureCode.of("test", "any"), "always"));

        AttemptOutcome<String> result = everythingRetryable.attempt(() -> {
            throw new IOException("whatever");
        });

        assertThat(result).isInstanceOf(AttemptOutcome.RetryableFailure.class);
    }
}
