package org.javai.resilience.datastore;

import org.javai.resilience.RecoverySettings;
import org.javai.resilience.circuit.CircuitBreakerState;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time view of the data-store adapter.
 *
 * @param circuitBreakers every breaker, sorted by key
 * @param retryableSignatures error signatures treated as transient
 * @param settings effective defaults
 * @param healthQuery statement used by health checks
 */
public record DataStoreStats(
        Map<String, CircuitBreakerState> circuitBreakers,
        List<String> retryableSignatures,
        RecoverySettings settings,
        String healthQuery
) {

    public DataStoreStats {
        circuitBreakers = Collections.unmodifiableMap(new TreeMap<>(circuitBreakers));
        retryableSignatures = List.copyOf(retryableSignatures);
    }
}
