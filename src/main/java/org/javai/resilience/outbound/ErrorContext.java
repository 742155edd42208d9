package org.javai.resilience.outbound;

import org.javai.resilience.ops.OpReporterUtils;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Describes the boundary request a failure happened in.
 *
 * @param route request path, for example {@code /api/tracks/42}
 * @param method request method
 * @param requestId correlation identifier returned to the client
 * @param timestamp when the request arrived
 * @param userAgent client user agent (may be null)
 * @param clientIp client address (may be null)
 */
public record ErrorContext(
        String route,
        String method,
        String requestId,
        Instant timestamp,
        String userAgent,
        String clientIp
) {

    public ErrorContext {
        Objects.requireNonNull(route, "route must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * Creates a context for a request arriving now, with a fresh request id.
     */
    public static ErrorContext of(String method, String route) {
        Instant now = Instant.now();
        return new ErrorContext(route, method, newRequestId(now), now, null, null);
    }

    public ErrorContext withClient(String userAgent, String clientIp) {
        return new ErrorContext(route, method, requestId, timestamp, userAgent, clientIp);
    }

    /**
     * Request ids look like {@code req_1700000000000_k3j9x0a2b}.
     */
    static String newRequestId(Instant now) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        String suffix = (random + "000000000").substring(0, 9);
        return "req_" + now.toEpochMilli() + "_" + suffix;
    }

    /**
     * Default breaker key for the route: {@code api-GET-tracks-42} for {@code GET /api/tracks/42}.
     */
    public String operationName() {
        return "api-" + method.toUpperCase(Locale.ROOT) + "-" + routePattern();
    }

    public String isoTimestamp() {
        return OpReporterUtils.formatTimestamp(timestamp);
    }

    private String routePattern() {
        String path = route;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String pattern = path.replaceFirst("^/?api/", "").replaceAll("^/+|/+$", "").replace('/', '-');
        return pattern.isEmpty() ? "root" : pattern;
    }
}
