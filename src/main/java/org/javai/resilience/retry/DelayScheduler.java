package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Produces stages that complete after a delay. This is the only timer the
 * resilience layer uses: for backoff between retries and for timeout races.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * Returns a stage that completes after {@code delay}. Cancelling the returned
     * future must release the underlying timer.
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * Races {@code work} against a timer. Whichever finishes first decides the result;
     * the other is ignored. On timeout the returned future fails with the error from
     * {@code onTimeout} and a late result of {@code work} is discarded.
     * A zero or negative timeout disables the race.
     */
    default <T> CompletableFuture<T> within(CompletionStage<T> work, Duration timeout,
                                            Supplier<? extends Throwable> onTimeout) {
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(onTimeout, "onTimeout must not be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> timer = timeout.isZero() || timeout.isNegative()
                ? new CompletableFuture<>()
                : delay(timeout);
        // The timer goes away however the result settles, including a caller's cancel
        result.whenComplete((value, error) -> timer.cancel(false));
        timer.thenRun(() -> result.completeExceptionally(onTimeout.get()));
        work.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        return result;
    }
}
