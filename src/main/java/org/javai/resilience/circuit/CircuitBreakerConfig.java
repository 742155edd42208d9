package org.javai.resilience.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds for one breaker.
 *
 * @param failureThreshold consecutive failures that open the breaker (at least 1)
 * @param cooldown minimum time spent OPEN before a probe is admitted
 */
public record CircuitBreakerConfig(int failureThreshold, Duration cooldown) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(1);

    public CircuitBreakerConfig {
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN);
    }

    public static CircuitBreakerConfig of(int failureThreshold, Duration cooldown) {
        return new CircuitBreakerConfig(failureThreshold, cooldown);
    }
}
