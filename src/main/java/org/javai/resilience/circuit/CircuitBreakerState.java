package org.javai.resilience.circuit;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one breaker. The registry swaps whole snapshots with
 * compare-and-set, so every field changes together.
 *
 * @param key identity of the protected operation
 * @param state current state
 * @param consecutiveFailures failures since the last success while CLOSED
 * @param openedAt when the breaker last opened (null unless it has opened since the last close)
 * @param failureThreshold failures that open the breaker
 * @param cooldown minimum OPEN duration before a probe
 * @param epoch bumped by every reset; outcomes from an older epoch are ignored
 * @param probeSequence number of probes admitted so far; identifies the current probe
 */
public record CircuitBreakerState(
        String key,
        CircuitState state,
        int consecutiveFailures,
        Instant openedAt,
        int failureThreshold,
        Duration cooldown,
        long epoch,
        long probeSequence
) {

    public CircuitBreakerState {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (state != CircuitState.CLOSED) {
            Objects.requireNonNull(openedAt, "openedAt must be set unless CLOSED");
        }
    }

    static CircuitBreakerState initial(String key, CircuitBreakerConfig config) {
        return new CircuitBreakerState(key, CircuitState.CLOSED, 0, null,
                config.failureThreshold(), config.cooldown(), 0L, 0L);
    }

    public long cooldownMs() {
        return cooldown.toMillis();
    }

    /**
     * Returns when a probe may be admitted, or null if the breaker is CLOSED.
     */
    public Instant probeAllowedAt() {
        return openedAt == null ? null : openedAt.plus(cooldown);
    }

    boolean cooldownElapsed(Instant now) {
        return !now.isBefore(probeAllowedAt());
    }

    CircuitBreakerState withFailure(Instant now) {
        int failures = consecutiveFailures + 1;
        if (failures >= failureThreshold) {
            return new CircuitBreakerState(key, CircuitState.OPEN, failures, now, failureThreshold, cooldown, epoch, probeSequence);
        }
        return new CircuitBreakerState(key, CircuitState.CLOSED, failures, openedAt, failureThreshold, cooldown, epoch,
                probeSequence);
    }

    CircuitBreakerState toHalfOpen() {
        return new CircuitBreakerState(key, CircuitState.HALF_OPEN, consecutiveFailures, openedAt,
                failureThreshold, cooldown, epoch, probeSequence + 1);
    }

    CircuitBreakerState toOpen(Instant now) {
        return new CircuitBreakerState(key, CircuitState.OPEN, consecutiveFailures, now,
                failureThreshold, cooldown, epoch, probeSequence);
    }

    CircuitBreakerState toClosed() {
        return new CircuitBreakerState(key, CircuitState.CLOSED, 0, null, failureThreshold, cooldown, epoch, probeSequence);
    }

    CircuitBreakerState reset() {
        return new CircuitBreakerState(key, CircuitState.CLOSED, 0, null, failureThreshold, cooldown, epoch + 1,
                probeSequence);
    }
}
