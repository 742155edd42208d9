package org.javai.resilience;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A fully-contextualized failure ready for reporting and policy evaluation.
 *
 * @param code The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type The failure type (TRANSIENT, TERMINAL)
 * @param exception The underlying exception (may be null)
 * @param operation The operation that failed, usually the breaker key
 * @param occurredAt When the failure happened
 * @param correlationId Trace correlation identifier (may be null)
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        FailureCode code,
        String message,
        FailureType type,
        Throwable exception,
        String operation,
        Instant occurredAt,
        String correlationId,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Combines a classified kind with the context of the attempt that produced it.
     */
    public static Failure of(FailureKind kind, String operation, Throwable exception) {
        Objects.requireNonNull(kind, "kind must not be null");
        return new Failure(kind.code(), kind.message(), kind.type(), exception,
                operation, Instant.now(), null, null);
    }

    /**
     * Creates a transient failure that may resolve on retry.
     */
    public static Failure transientFailure(FailureCode code, String message, String operation, Throwable exception) {
        return new Failure(code, message, FailureType.TRANSIENT, exception,
                operation, Instant.now(), null, null);
    }

    /**
     * Creates a terminal failure that will not resolve on retry.
     */
    public static Failure terminalFailure(FailureCode code, String message, String operation, Throwable exception) {
        return new Failure(code, message, FailureType.TERMINAL, exception,
                operation, Instant.now(), null, null);
    }

    /**
     * Returns a new Failure with the specified correlationId and tags added.
     */
    public Failure withContext(String correlationId, Map<String, String> tags) {
        return new Failure(code, message, type, exception, operation, occurredAt, correlationId, tags);
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
