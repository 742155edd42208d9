package org.javai.resilience.retry;

import java.util.Objects;

/**
 * Call-site hooks fired by the {@link Retrier}.
 */
public interface RetryListener {

    /**
     * Fired before waiting for the next attempt.
     *
     * @param attemptNumber the 1-based number of the attempt that just failed
     * @param error the error that attempt failed with
     */
    default void onRetry(int attemptNumber, Throwable error) {
    }

    /**
     * Fired once when the sequence gives up, either because the error was terminal
     * or because the retry budget ran out.
     *
     * @param error the final error
     * @param totalAttempts how many times the operation ran
     */
    default void onFailure(Throwable error, int totalAttempts) {
    }

    static RetryListener noOp() {
        return new RetryListener() {};
    }

    /**
     * Returns a listener that calls this listener, then {@code next}.
     */
    default RetryListener andThen(RetryListener next) {
        Objects.requireNonNull(next, "next must not be null");
        RetryListener first = this;
        return new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                first.onRetry(attemptNumber, error);
                next.onRetry(attemptNumber, error);
            }

            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                first.onFailure(error, totalAttempts);
                next.onFailure(error, totalAttempts);
            }
        };
    }
}
