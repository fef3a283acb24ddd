package org.javai.jobguard.classify;

import org.javai.jobguard.FailureCode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;

import static org.assertj.core.api.Assertions.*;

class VocabularyErrorClassifierTest {

    private final ErrorClassifier classifier = ErrorClassifier.defaults();

    @Test
    void throttlingCode_isRetryable() {
        Classification result = classifier.classify(new ProviderException("ThrottlingException", "Rate exceeded"));

        assertThat(result.errorClass()).isEqualTo(ErrorClass.RETRYABLE);
        assertThat(result.code()).isEqualTo(FailureCode.of("provider", "ThrottlingException"));
        assertThat(result.matchedOn()).isEqualTo("code ThrottlingException");
    }

    @Test
    void rateLimitPhrase_isRetryable() {
        Classification result = classifier.classify(new RuntimeException("rate limit exceeded"));

        assertThat(result.isRetryable()).isTrue();
        assertThat(result.code()).isEqualTo(FailureCode.of("message", "rate_limit"));
    }

    @Test
    void invalidParameterMessage_isFatal() {
        Classification result = classifier.classify(new RuntimeException("invalid parameter value"));

        assertThat(result.errorClass()).isEqualTo(ErrorClass.FATAL);
        assertThat(result.matchedOn()).isEqualTo("default");
        assertThat(result.code()).isEqualTo(FailureCode.of("unclassified", "RuntimeException"));
    }

    @Test
    void accessDeniedCode_isFatal() {
        Classification result = classifier.classify(new ProviderException("AccessDeniedException", "User is not authorized"));

        assertThat(result.errorClass()).isEqualTo(ErrorClass.FATAL);
        assertThat(result.code()).isEqualTo(FailureCode.of("provider", "AccessDeniedException"));
    }

    @Test
    void nullError_isFatal() {
        Classification result = classifier.classify(null);

        assertThat(result.errorClass()).isEqualTo(ErrorClass.FATAL);
        assertThat(result.code()).isEqualTo(FailureCode.of("unclassified", "no_error"));
        assertThat(classifier.isRetryable(null)).isFalse();
    }

    @Test
    void explicitFatalCode_winsOverRetryablePhrase() {
        Classification result = classifier.classify(
                new ProviderException("AccessDeniedException", "request timed out while checking permissions"));

        assertThat(result.errorClass()).isEqualTo(ErrorClass.FATAL);
    }

    @Test
    void unknownCode_fallsBackToPhrases() {
        Classification result = classifier.classify(
                new ProviderException("ConflictException", "Concurrent modification of the vault"));

        assertThat(result.isRetryable()).isTrue();
        assertThat(result.code()).isEqualTo(FailureCode.of("message", "conflict"));
    }

    @Test
    void codeIsPartOfMatchedText() {
        // the message alone says nothing transient, the code does
        Classification result = classifier.classify(new ProviderException("GatewayTimeout", "upstream did not answer"));

        assertThat(result.isRetryable()).isTrue();
    }

    @Test
    void wrappedProviderError_isFoundInCauseChain() {
        Throwable wrapped = new IllegalStateException("call failed",
                new ProviderException("ProvisionedThroughputExceededException", "slow down"));

        Classification result = classifier.classify(wrapped);

        assertThat(result.isRetryable()).isTrue();
        assertThat(result.code()).isEqualTo(FailureCode.of("provider", "ProvisionedThroughputExceededException"));
    }

    @Test
    void phraseInNestedCause_isMatched() {
        Throwable wrapped = new UncheckedIOException("describe failed", new ConnectException("Connection refused"));

        assertThat(classifier.isRetryable(wrapped)).isTrue();
    }

    @Test
    void unmatchedError_isFatalByDefault() {
        Classification result = classifier.classify(new IOException("No space left on device"));

        assertThat(result.errorClass()).isEqualTo(ErrorClass.FATAL);
        assertThat(result.code()).isEqualTo(FailureCode.of("unclassified", "IOException"));
    }

    @Test
    void unmatchedProviderError_isNamedByItsCode() {
        Classification result = classifier.classify(new ProviderException("ResourceNotFoundException", "no such vault"));

        assertThat(result.errorClass()).isEqualTo(ErrorClass.FATAL);
        assertThat(result.code()).isEqualTo(FailureCode.of("unclassified", "ResourceNotFoundException"));
    }

    @Test
    void selfReferencingCauseChain_terminates() {
        RuntimeException error = new RuntimeException("outer") {
            @Override
            public synchronized Throwable getCause() {
                return this;
            }
        };

        assertThat(classifier.classify(error).errorClass()).isEqualTo(ErrorClass.FATAL);
    }
}
