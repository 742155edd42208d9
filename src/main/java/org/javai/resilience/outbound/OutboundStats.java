package org.javai.resilience.outbound;

import org.javai.resilience.RecoverySettings;
import org.javai.resilience.circuit.CircuitBreakerState;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time view of the outbound-call adapter.
 */
public record OutboundStats(
        Map<String, CircuitBreakerState> circuitBreakers,
        List<String> retryableSignatures,
        RecoverySettings settings
) {

    public OutboundStats {
        circuitBreakers = Collections.unmodifiableMap(new TreeMap<>(circuitBreakers));
        retryableSignatures = List.copyOf(retryableSignatures);
    }
}
