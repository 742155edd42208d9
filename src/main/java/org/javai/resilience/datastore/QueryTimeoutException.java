package org.javai.resilience.datastore;

import org.javai.resilience.TransientException;

import java.time.Duration;

/**
 * Raised when a query does not finish within its timeout. Retryable.
 */
public class QueryTimeoutException extends TransientException {

    public static final String CODE = "QUERY_TIMEOUT";

    private final Duration timeout;

    public QueryTimeoutException(Duration timeout) {
        super(CODE, "Query timeout after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
