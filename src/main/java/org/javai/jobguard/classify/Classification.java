package org.javai.jobguard.classify;

import org.javai.jobguard.FailureCode;

import java.util.Objects;

/**
 * The verdict of an {@link ErrorClassifier}, with the table entry that produced it.
 *
 * @param errorClass retryable or fatal
 * @param code stable identifier for reporting, e.g. {@code provider:ThrottlingException}
 * @param matchedOn the code or phrase that matched, or {@code "default"} when nothing did
 */
public record Classification(ErrorClass errorClass, FailureCode code, String matchedOn) {

    static final String NAMESPACE_PROVIDER = "provider";
    static final String NAMESPACE_MESSAGE = "message";
    static final String NAMESPACE_UNCLASSIFIED = "unclassified";

    public Classification {
        Objects.requireNonNull(errorClass, "errorClass must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(matchedOn, "matchedOn must not be null");
    }

    public boolean isRetryable() {
        return errorClass == ErrorClass.RETRYABLE;
    }
}
