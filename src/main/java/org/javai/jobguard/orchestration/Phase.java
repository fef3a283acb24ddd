package org.javai.jobguard.orchestration;

import org.javai.jobguard.Outcome;

import java.util.Objects;
import java.util.function.Function;

/**
 * One step of an {@link OrchestrationSequence}: consumes the previous phase's output and
 * produces the next phase's input.
 *
 * <p>A phase reports operational failures as a failed {@link Outcome}; it does not throw.
 *
 * @param <I> what the phase consumes
 * @param <O> what the phase produces
 */
public interface Phase<I, O> {

    /**
     * Name used in progress events and failure messages.
     */
    String name();

    Outcome<O> run(I input);

    /**
     * Creates a phase from a function returning an Outcome.
     */
    static <I, O> Phase<I, O> of(String name, Function<? super I, Outcome<O>> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return new Phase<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Outcome<O> run(I input) {
                return Objects.requireNonNull(body.apply(input), () -> "phase " + name + " returned null");
            }

            @Override
            public String toString() {
                return "Phase[" + name + "]";
            }
        };
    }
}
