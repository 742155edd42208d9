package org.javai.resilience;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of one resilient invocation: either {@link Ok} containing a value,
 * or {@link Fail} containing the final {@link Failure}. Both record how many times
 * the operation was actually invoked.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome.
     *
     * @param value the successful value (may be null)
     * @param attempts how many times the operation ran
     */
    record Ok<T>(T value, int attempts) implements Outcome<T> {

        public Ok {
            if (attempts < 0) {
                throw new IllegalArgumentException("attempts must be >= 0");
            }
        }

        @Override
        public boolean isOk() {
            return true;
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
            return new Ok<>(mapper.apply(value), attempts);
        }
    }

    /**
     * A failed outcome.
     *
     * @param failure the final failure
     * @param attempts how many times the operation ran; zero when a breaker rejected the call
     */
    record Fail<T>(Failure failure, int attempts) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
            if (attempts < 0) {
                throw new IllegalArgumentException("attempts must be >= 0");
            }
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure, attempts);
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
            return new Fail<>(failure, attempts);
        }
    }

    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    int attempts();

    T getOrThrow();

    T getOrElse(T defaultValue);

    T getOrElseGet(Supplier<? extends T> supplier);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    static <T> Outcome<T> ok(T value, int attempts) {
        return new Ok<>(value, attempts);
    }

    static <T> Outcome<T> fail(Failure failure, int attempts) {
        return new Fail<>(failure, attempts);
    }
}
