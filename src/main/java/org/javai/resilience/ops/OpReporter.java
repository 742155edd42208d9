package org.javai.resilience.ops;

import org.javai.resilience.DegradedModeSignal;
import org.javai.resilience.Failure;
import org.javai.resilience.circuit.CircuitState;

import java.time.Duration;

/**
 * Receives structured events from the resilience layer.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporting is fire-and-forget: nothing here may change the outcome of an operation.
 */
public interface OpReporter {

    /**
     * Reports a failure that ended a call without further retries.
     */
    void report(Failure failure);

    /**
     * Reports a retry attempt.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The 1-based number of the attempt that failed
     * @param delay The backoff delay before the next attempt
     * @param policyId The retry policy being applied
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that retry attempts have been exhausted.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     * @param policyId The retry policy that was exhausted
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker state change. Called once per transition.
     */
    default void reportCircuitTransition(String key, CircuitState from, CircuitState to) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a fallback value was served instead of a real result.
     */
    default void reportDegraded(DegradedModeSignal signal) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
