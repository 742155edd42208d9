package org.javai.resilience;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A value served in place of a real result when a call is not allowed to run,
 * or when it ran and used up its retries.
 *
 * @param <T> The type of the fallback value
 */
@FunctionalInterface
public interface Fallback<T> {

    /**
     * Produces the fallback value. Called at most once per degraded call.
     */
    T get();

    /**
     * A fallback that always serves the same value.
     */
    static <T> Fallback<T> of(T value) {
        return () -> value;
    }

    /**
     * A fallback computed when it is needed, for example from a cache.
     */
    static <T> Fallback<T> from(Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        return supplier::get;
    }
}
