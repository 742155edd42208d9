package org.javai.resilience.outbound;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

/**
 * What the boundary layer sends to a client. A degraded response carries fallback or
 * partial data that must not be treated as authoritative.
 *
 * @param status HTTP status; not part of the body
 * @param success whether the request is considered served
 * @param degraded whether {@code data} is a fallback
 * @param message human-readable summary (may be null)
 * @param data payload (may be null)
 * @param error error details for failed responses (may be null)
 * @param timestamp ISO-8601 time of the response (may be null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BoundaryResponse(
        @JsonIgnore int status,
        boolean success,
        boolean degraded,
        String message,
        Object data,
        ErrorBody error,
        String timestamp
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Error details. Only sanitized text ever goes into {@code message}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(String message, String code, String timestamp, String requestId) {
    }

    public static BoundaryResponse ok(Object data) {
        return new BoundaryResponse(200, true, false, null, data, null, null);
    }

    public static BoundaryResponse degraded(int status, boolean success, String message, Object data, String timestamp) {
        return new BoundaryResponse(status, success, true, message, data, null, timestamp);
    }

    public static BoundaryResponse error(int status, ErrorBody error) {
        return new BoundaryResponse(status, false, false, null, null, error, null);
    }

    /**
     * Renders the body as JSON.
     *
     * @throws UncheckedIOException if the payload cannot be serialized
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize boundary response", e);
        }
    }
}
