package org.javai.resilience;

/**
 * A failure that is expected to clear up on its own: connection reset, connection loss, timeout.
 * Always classified as retryable.
 */
public class TransientException extends ResilienceException {

    public TransientException(String code, String message) {
        this(code, message, null);
    }

    public TransientException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
