package org.javai.resilience.circuit;

/**
 * The states of a per-key circuit breaker.
 */
public enum CircuitState {
    /**
     * Initial state. Operations run; consecutive failures are counted.
     */
    CLOSED,
    /**
     * The breaker tripped. Calls are rejected without running the operation
     * until the cooldown has elapsed.
     */
    OPEN,
    /**
     * A single probe call is in flight. Everyone else is rejected until it resolves.
     */
    HALF_OPEN
}
