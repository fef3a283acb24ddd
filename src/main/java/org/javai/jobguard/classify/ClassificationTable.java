package org.javai.jobguard.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The reviewed vocabulary that drives error classification: provider condition codes and
 * message phrases, each mapped to {@link ErrorClass#RETRYABLE} or {@link ErrorClass#FATAL}.
 *
 * <p>Codes are matched exactly. Phrases are matched case-insensitively as substrings, in the order
 * they were added; the first phrase found in the text wins.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ClassificationTable table = ClassificationTable.builder()
 *     .fromDefaults()
 *     .code("SlowDown", ErrorClass.RETRYABLE)
 *     .phrase("quota exceeded", ErrorClass.FATAL)
 *     .build();
 * }</pre>
 */
public final class ClassificationTable {

    private static final ClassificationTable DEFAULTS = builder()
            .code("RequestLimitExceeded", ErrorClass.RETRYABLE)
            .code("Throttling", ErrorClass.RETRYABLE)
            .code("ThrottlingException", ErrorClass.RETRYABLE)
            .code("TooManyRequestsException", ErrorClass.RETRYABLE)
            .code("ProvisionedThroughputExceededException", ErrorClass.RETRYABLE)
            .code("ServiceUnavailable", ErrorClass.RETRYABLE)
            .code("InternalServerError", ErrorClass.RETRYABLE)
            .code("InternalError", ErrorClass.RETRYABLE)
            .code("AccessDenied", ErrorClass.FATAL)
            .code("AccessDeniedException", ErrorClass.FATAL)
            .code("UnauthorizedOperation", ErrorClass.FATAL)
            .code("ValidationException", ErrorClass.FATAL)
            .code("InvalidParameterValue", ErrorClass.FATAL)
            .code("InvalidParameterValueException", ErrorClass.FATAL)
            .phrase("rate exceeded", ErrorClass.RETRYABLE)
            .phrase("rate limit", ErrorClass.RETRYABLE)
            .phrase("throttle", ErrorClass.RETRYABLE)
            .phrase("too many requests", ErrorClass.RETRYABLE)
            .phrase("service unavailable", ErrorClass.RETRYABLE)
            .phrase("temporary failure", ErrorClass.RETRYABLE)
            .phrase("timed out", ErrorClass.RETRYABLE)
            .phrase("timeout", ErrorClass.RETRYABLE)
            .phrase("connection refused", ErrorClass.RETRYABLE)
            .phrase("connection reset", ErrorClass.RETRYABLE)
            .phrase("no such host", ErrorClass.RETRYABLE)
            .phrase("internal server error", ErrorClass.RETRYABLE)
            .phrase("bad gateway", ErrorClass.RETRYABLE)
            .phrase("gateway timeout", ErrorClass.RETRYABLE)
            .phrase("conflict", ErrorClass.RETRYABLE)
            .phrase("concurrent", ErrorClass.RETRYABLE)
            .build();

    private final Map<String, ErrorClass> codes;
    private final Map<String, ErrorClass> phrases;

    private ClassificationTable(Map<String, ErrorClass> codes, Map<String, ErrorClass> phrases) {
        this.codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
        this.phrases = Collections.unmodifiableMap(new LinkedHashMap<>(phrases));
    }

    /**
     * The vocabulary for cloud control-plane calls: throttling, unavailability and server-error
     * codes, plus the transient phrases seen in SDK and transport error messages.
     */
    public static ClassificationTable defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a provider condition code.
     *
     * @return the class for the code, or empty if the table has no entry for it
     */
    public Optional<ErrorClass> classOfCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codes.get(code));
    }

    /**
     * Finds the first phrase contained in the given text, ignoring case.
     *
     * @return the matching phrase (lower case), or empty
     */
    public Optional<String> findPhrase(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : phrases.keySet()) {
            if (lower.contains(phrase)) {
                return Optional.of(phrase);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the class of a phrase previously returned by {@link #findPhrase(String)}.
     */
    public ErrorClass classOfPhrase(String phrase) {
        ErrorClass errorClass = phrases.get(phrase);
        if (errorClass == null) {
            throw new IllegalArgumentException("Unknown phrase: " + phrase);
        }
        return errorClass;
    }

    public Map<String, ErrorClass> codes() {
        return codes;
    }

    public Map<String, ErrorClass> phrases() {
        return phrases;
    }

    /**
     * Builder for a {@link ClassificationTable}. Later entries for the same code or phrase
     * replace earlier ones.
     */
    public static final class Builder {
        private final Map<String, ErrorClass> codes = new LinkedHashMap<>();
        private final Map<String, ErrorClass> phrases = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Starts from the default vocabulary.
         */
        public Builder fromDefaults() {
            codes.putAll(DEFAULTS.codes);
            phrases.putAll(DEFAULTS.phrases);
            return this;
        }

        public Builder code(String code, ErrorClass errorClass) {
            Objects.requireNonNull(code, "code must not be null");
            Objects.requireNonNull(errorClass, "errorClass must not be null");
            if (code.isBlank()) {
                throw new IllegalArgumentException("code must not be blank");
            }
            codes.put(code, errorClass);
            return this;
        }

        public Builder phrase(String phrase, ErrorClass errorClass) {
            Objects.requireNonNull(phrase, "phrase must not be null");
            Objects.requireNonNull(errorClass, "errorClass must not be null");
            if (phrase.isBlank()) {
                throw new IllegalArgumentException("phrase must not be blank");
            }
            phrases.put(phrase.toLowerCase(Locale.ROOT), errorClass);
            return this;
        }

        public ClassificationTable build() {
            return new ClassificationTable(codes, phrases);
        }
    }
}
