package org.javai.jobguard.orchestration;

/**
 * A function that may throw a checked exception, typically a remote call taking the previous
 * phase's output.
 *
 * @param <I> The input type
 * @param <O> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<I, O, E extends Exception> {

    O apply(I input) throws E;
}
