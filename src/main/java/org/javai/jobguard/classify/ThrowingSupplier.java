package org.javai.jobguard.classify;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Boundary} to wrap remote calls.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
