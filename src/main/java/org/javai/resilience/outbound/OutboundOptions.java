package org.javai.resilience.outbound;

import org.javai.resilience.circuit.CircuitBreakerConfig;
import org.javai.resilience.retry.RetryListener;

/**
 * Per-call overrides for {@link OutboundCallRecovery}. Null fields use the adapter's settings.
 *
 * @param operationName breaker key for a boundary handler (may be null)
 * @param maxRetries retry budget (may be null)
 * @param circuitBreaker breaker thresholds (may be null)
 * @param gracefulDegradation answer failures with {@code fallbackData} when there is some
 * @param fallbackData payload of degraded responses (may be null)
 * @param listener extra retry hooks, called after the adapter's own logging
 */
public record OutboundOptions(
        String operationName,
        Integer maxRetries,
        CircuitBreakerConfig circuitBreaker,
        boolean gracefulDegradation,
        Object fallbackData,
        RetryListener listener
) {

    public OutboundOptions {
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        listener = listener == null ? RetryListener.noOp() : listener;
    }

    public static OutboundOptions defaults() {
        return new OutboundOptions(null, null, null, true, null, null);
    }

    public OutboundOptions withOperationName(String operationName) {
        return new OutboundOptions(operationName, maxRetries, circuitBreaker, gracefulDegradation, fallbackData, listener);
    }

    public OutboundOptions withMaxRetries(int maxRetries) {
        return new OutboundOptions(operationName, maxRetries, circuitBreaker, gracefulDegradation, fallbackData, listener);
    }

    public OutboundOptions withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new OutboundOptions(operationName, maxRetries, circuitBreaker, gracefulDegradation, fallbackData, listener);
    }

    public OutboundOptions withGracefulDegradation(boolean gracefulDegradation) {
        return new OutboundOptions(operationName, maxRetries, circuitBreaker, gracefulDegradation, fallbackData, listener);
    }

    public OutboundOptions withFallbackData(Object fallbackData) {
        return new OutboundOptions(operationName, maxRetries, circuitBreaker, gracefulDegradation, fallbackData, listener);
    }

    public OutboundOptions withListener(RetryListener listener) {
        return new OutboundOptions(operationName, maxRetries, circuitBreaker, gracefulDegradation, fallbackData, listener);
    }
}
