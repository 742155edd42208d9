package org.javai.resilience.datastore;

import org.javai.resilience.circuit.CircuitBreakerConfig;
import org.javai.resilience.retry.RetryListener;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call overrides for {@link DataStoreRecovery}. Null fields use the adapter's settings.
 *
 * @param operationName breaker key for the call (may be null)
 * @param maxRetries retry budget (may be null)
 * @param queryTimeout query timeout; zero disables it (may be null)
 * @param circuitBreaker breaker thresholds (may be null)
 * @param listener extra retry hooks, called after the adapter's own logging
 * @param validateConnection run the health query on each borrowed connection before using it
 */
public record DataStoreOptions(
        String operationName,
        Integer maxRetries,
        Duration queryTimeout,
        CircuitBreakerConfig circuitBreaker,
        RetryListener listener,
        boolean validateConnection
) {

    public DataStoreOptions {
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        if (queryTimeout != null && queryTimeout.isNegative()) {
            throw new IllegalArgumentException("queryTimeout must not be negative");
        }
        listener = listener == null ? RetryListener.noOp() : listener;
    }

    public static DataStoreOptions defaults() {
        return new DataStoreOptions(null, null, null, null, null, false);
    }

    public static DataStoreOptions named(String operationName) {
        Objects.requireNonNull(operationName, "operationName must not be null");
        return new DataStoreOptions(operationName, null, null, null, null, false);
    }

    public DataStoreOptions withOperationName(String operationName) {
        return new DataStoreOptions(operationName, maxRetries, queryTimeout, circuitBreaker, listener, validateConnection);
    }

    public DataStoreOptions withMaxRetries(int maxRetries) {
        return new DataStoreOptions(operationName, maxRetries, queryTimeout, circuitBreaker, listener, validateConnection);
    }

    public DataStoreOptions withQueryTimeout(Duration queryTimeout) {
        return new DataStoreOptions(operationName, maxRetries, queryTimeout, circuitBreaker, listener, validateConnection);
    }

    public DataStoreOptions withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new DataStoreOptions(operationName, maxRetries, queryTimeout, circuitBreaker, listener, validateConnection);
    }

    public DataStoreOptions withListener(RetryListener listener) {
        return new DataStoreOptions(operationName, maxRetries, queryTimeout, circuitBreaker, listener, validateConnection);
    }

    public DataStoreOptions withValidateConnection(boolean validateConnection) {
        return new DataStoreOptions(operationName, maxRetries, queryTimeout, circuitBreaker, listener, validateConnection);
    }
}
