package org.javai.resilience.circuit;

import org.javai.resilience.ResilienceException;

import java.time.Instant;

/**
 * Raised instead of running an operation whose breaker rejects calls.
 */
public class CircuitOpenException extends ResilienceException {

    public static final String CODE = "CIRCUIT_OPEN";

    private final String key;
    private final CircuitState state;
    private final Instant retryAt;

    public CircuitOpenException(String key, CircuitState state, Instant retryAt) {
        super(CODE, "Circuit breaker is " + state + " for [" + key + "]", null);
        this.key = key;
        this.state = state;
        this.retryAt = retryAt;
    }

    public String key() {
        return key;
    }

    /**
     * The state seen when the call was rejected: OPEN, or HALF_OPEN while another caller probes.
     */
    public CircuitState state() {
        return state;
    }

    /**
     * Earliest instant at which a probe may be admitted.
     */
    public Instant retryAt() {
        return retryAt;
    }
}
