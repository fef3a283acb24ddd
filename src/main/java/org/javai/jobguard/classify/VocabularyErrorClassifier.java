package org.javai.jobguard.classify;

import org.javai.jobguard.FailureCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies errors of cloud control-plane calls using a {@link ClassificationTable}.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>the first {@link ProviderError} code in the cause chain that has a table entry
 *       decides outright;</li>
 *   <li>otherwise the first phrase found in any message of the cause chain decides;</li>
 *   <li>otherwise the error is {@link ErrorClass#FATAL}, since unknown errors are presumed
 *       permanent.</li>
 * </ol>
 */
public class VocabularyErrorClassifier implements ErrorClassifier {

    private static final FailureCode NO_ERROR = FailureCode.of(Classification.NAMESPACE_UNCLASSIFIED, "no_error");

    private final ClassificationTable table;

    public VocabularyErrorClassifier(ClassificationTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public Classification classify(Throwable error) {
        if (error == null) {
            return new Classification(ErrorClass.FATAL, NO_ERROR, "no error");
        }

        Optional<Classification> byCode = classifyByCode(error);
        if (byCode.isPresent()) {
            return byCode.get();
        }

        for (Throwable t : causeChain(error)) {
            Optional<String> phrase = table.findPhrase(messageOf(t));
            if (phrase.isPresent()) {
                return new Classification(
                        table.classOfPhrase(phrase.get()),
                        FailureCode.of(Classification.NAMESPACE_MESSAGE, phrase.get().replace(' ', '_')),
                        "phrase '" + phrase.get() + "'");
            }
        }

        return new Classification(
                ErrorClass.FATAL,
                FailureCode.of(Classification.NAMESPACE_UNCLASSIFIED, unclassifiedName(error)),
                "default");
    }

    private Optional<Classification> classifyByCode(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof ProviderError providerError) {
                String code = providerError.errorCode();
                Optional<ErrorClass> errorClass = table.classOfCode(code);
                if (errorClass.isPresent()) {
                    return Optional.of(new Classification(
                            errorClass.get(),
                            FailureCode.of(Classification.NAMESPACE_PROVIDER, code),
                            "code " + code));
                }
            }
        }
        return Optional.empty();
    }

    private static String unclassifiedName(Throwable error) {
        if (error instanceof ProviderError providerError
                && providerError.errorCode() != null
                && !providerError.errorCode().isBlank()) {
            return providerError.errorCode();
        }
        return error.getClass().getSimpleName().isEmpty() ? "error" : error.getClass().getSimpleName();
    }

    private static String messageOf(Throwable t) {
        if (t instanceof ProviderError providerError && providerError.errorCode() != null) {
            return providerError.errorCode() + ": " + t.getMessage();
        }
        return t.getMessage();
    }

    private static List<Throwable> causeChain(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
            chain.add(t);
        }
        return chain;
    }
}
