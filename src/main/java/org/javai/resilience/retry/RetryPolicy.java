package org.javai.resilience.retry;

import org.javai.resilience.FailureType;
import org.javai.resilience.boundary.FailureClassifier;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether and when to retry after a failure.
 *
 * <p>The first call is never counted against {@code maxRetries}, so an operation
 * runs at most {@code maxRetries + 1} times. A policy is immutable; the copy
 * methods return new instances.
 *
 * @param id A unique identifier for this policy, used in reporting
 * @param maxRetries How many retries follow the first call (non-negative)
 * @param backoff Delay strategy between attempts
 * @param classifier Overrides the executor's classifier for this call (may be null)
 */
public record RetryPolicy(String id, int maxRetries, Backoff backoff, FailureClassifier classifier) {

    public RetryPolicy {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
    }

    /**
     * Creates a policy that never retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy("no-retry", 0, Backoff.none(), null);
    }

    public static RetryPolicy of(String id, int maxRetries, Backoff backoff) {
        return new RetryPolicy(id, maxRetries, backoff, null);
    }

    /**
     * Creates a simple policy with a fixed delay between attempts.
     */
    public static RetryPolicy fixed(String id, int maxRetries, Duration delay) {
        return new RetryPolicy(id, maxRetries, Backoff.fixed(delay), null);
    }

    /**
     * Creates a policy whose delay doubles on each retry, capped at {@code maxDelay}.
     */
    public static RetryPolicy exponentialBackoff(String id, int maxRetries, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(id, maxRetries, Backoff.exponential(initialDelay, 2.0, maxDelay), null);
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(id, maxRetries, backoff, classifier);
    }

    public RetryPolicy withClassifier(FailureClassifier classifier) {
        return new RetryPolicy(id, maxRetries, backoff, classifier);
    }

    public Optional<FailureClassifier> classifierOverride() {
        return Optional.ofNullable(classifier);
    }

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param attemptNumber The 1-based number of the attempt that just failed
     * @param type How the failure was classified
     * @return Retry with a delay, or GiveUp
     */
    public RetryDecision decide(int attemptNumber, FailureType type) {
        if (!type.isRetryable()) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (attemptNumber > maxRetries) {
            return RetryDecision.GiveUp.because("max retries reached");
        }
        Duration delay = backoff.delayFor(attemptNumber);
        return RetryDecision.Retry.after(delay == null || delay.isNegative() ? Duration.ZERO : delay);
    }
}
