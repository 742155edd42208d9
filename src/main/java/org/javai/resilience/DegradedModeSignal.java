package org.javai.resilience;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted whenever a fallback value is served instead of a real result.
 * Consumers at the boundary must treat the served value as not authoritative.
 *
 * @param key The operation or breaker key that degraded
 * @param reason Why the fallback was used (e.g., "circuit_open", "retries_exhausted")
 * @param occurredAt When the fallback was served
 */
public record DegradedModeSignal(String key, String reason, Instant occurredAt) {

    public static final String CIRCUIT_OPEN = "circuit_open";
    public static final String RETRIES_EXHAUSTED = "retries_exhausted";
    public static final String BOUNDARY_FALLBACK = "boundary_fallback";

    public DegradedModeSignal {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    public static DegradedModeSignal now(String key, String reason) {
        return new DegradedModeSignal(key, reason, Instant.now());
    }
}
