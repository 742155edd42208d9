package org.javai.resilience;

/**
 * Classifies failures by whether another attempt could succeed.
 */
public enum FailureType {
    /**
     * Temporary failure that may resolve on retry.
     * Examples: connection reset, connection lost, timeout.
     */
    TRANSIENT,

    /**
     * Failure that will not resolve on retry.
     * Examples: validation errors, business-rule violations, unknown errors.
     */
    TERMINAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
