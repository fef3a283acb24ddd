package org.javai.jobguard.classify;

/**
 * Decides whether a failed remote call is worth retrying.
 * Implementations should be deterministic and free of side effects.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies an error.
     *
     * @param error The failure of a remote call. A null error is not a failure and
     *              classifies as {@link ErrorClass#FATAL}; callers must not pass successes here.
     * @return the classification, never null
     */
    Classification classify(Throwable error);

    default boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    /**
     * The classifier backed by {@link ClassificationTable#defaults()}.
     */
    static ErrorClassifier defaults() {
        return new VocabularyErrorClassifier(ClassificationTable.defaults());
    }
}
