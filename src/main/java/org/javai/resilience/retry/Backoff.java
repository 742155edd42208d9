package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes the delay to wait before a retry.
 */
@FunctionalInterface
public interface Backoff {

    /**
     * Returns the delay before the given retry.
     *
     * @param retryNumber 1 for the first retry, 2 for the second, and so on
     * @return a non-negative delay
     */
    Duration delayFor(int retryNumber);

    /**
     * Retries immediately.
     */
    static Backoff none() {
        return retryNumber -> Duration.ZERO;
    }

    static Backoff fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return retryNumber -> delay;
    }

    /**
     * Exponential backoff: {@code base * multiplier^(retryNumber - 1)}, capped at {@code max}.
     */
    static Backoff exponential(Duration base, double multiplier, Duration max) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(max, "max must not be null");
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, was: " + multiplier);
        }
        return retryNumber -> {
            double millis = base.toMillis() * Math.pow(multiplier, Math.max(0, retryNumber - 1));
            if (millis >= max.toMillis()) {
                return max;
            }
            return Duration.ofMillis(Math.round(millis));
        };
    }

    /**
     * Adds a uniformly random extra delay in {@code [0, maxJitter)} so that callers
     * failing together do not retry together.
     */
    default Backoff withJitter(Duration maxJitter) {
        Objects.requireNonNull(maxJitter, "maxJitter must not be null");
        long bound = maxJitter.toMillis();
        // Jitter is applied in whole milliseconds
        if (bound <= 0) {
            return this;
        }
        return retryNumber -> delayFor(retryNumber)
                .plusMillis(ThreadLocalRandom.current().nextLong(bound));
    }
}
