package org.javai.resilience;

import java.util.Objects;

/**
 * Describes a failure without operational context.
 * This is what classifiers produce; the retry loop adds context to create a full {@link Failure}.
 *
 * @param code Namespaced failure identifier
 * @param message Human-readable description
 * @param type Whether the failure is worth another attempt
 */
public record FailureKind(FailureCode code, String message, FailureType type) {

    public FailureKind {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Creates a failure that should be retried.
     */
    public static FailureKind transientFailure(FailureCode code, String message) {
        return new FailureKind(code, message, FailureType.TRANSIENT);
    }

    /**
     * Creates a failure that must not be retried.
     */
    public static FailureKind terminalFailure(FailureCode code, String message) {
        return new FailureKind(code, message, FailureType.TERMINAL);
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
