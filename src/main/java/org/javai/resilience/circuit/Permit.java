package org.javai.resilience.circuit;

import java.util.Objects;

/**
 * Admission granted by {@link CircuitBreakerRegistry#acquire}. The holder must hand it
 * back exactly once through {@code onSuccess}, {@code onFailure} or {@code release}.
 *
 * @param key the breaker key
 * @param epoch the breaker epoch at admission
 * @param probeSequence the breaker's probe number for a HALF_OPEN probe, 0 otherwise
 */
public record Permit(String key, long epoch, long probeSequence) {

    public Permit {
        Objects.requireNonNull(key, "key must not be null");
    }

    /**
     * True if this call is the single HALF_OPEN probe.
     */
    public boolean probe() {
        return probeSequence > 0;
    }
}
