package org.javai.jobguard;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the final outcome of a guarded operation, a job poll or a whole sequence.
 * Either {@link Ok} containing the successful value, or {@link Fail} containing the
 * {@link Failure} that aborted it.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> mapFailure(Function<? super Failure, ? extends Failure> mapper) {
            return this;
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OperationAbortedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> mapFailure(Function<? super Failure, ? extends Failure> mapper) {
            Objects.requireNonNull(mapper);
            return new Fail<>(mapper.apply(failure));
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction

    /**
     * Returns the value, or throws {@link OperationAbortedException} carrying the failure.
     */
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    /**
     * Rewrites the failure of a failed outcome, leaving successful outcomes untouched.
     * Used to add context (phase, sequence) as a failure travels outwards.
     */
    Outcome<T> mapFailure(Function<? super Failure, ? extends Failure> mapper);

    // Static factories
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
