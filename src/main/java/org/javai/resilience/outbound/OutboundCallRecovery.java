package org.javai.resilience.outbound;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.DegradedModeSignal;
import org.javai.resilience.ErrorRecovery;
import org.javai.resilience.Fallback;
import org.javai.resilience.RecoveryOptions;
import org.javai.resilience.RecoverySettings;
import org.javai.resilience.boundary.AsyncOperation;
import org.javai.resilience.boundary.SignatureFailureClassifier;
import org.javai.resilience.circuit.CircuitOpenException;
import org.javai.resilience.ops.OpReporterUtils;
import org.javai.resilience.retry.RetryListener;
import org.javai.resilience.retry.RetryPolicy;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Calls external services with retries and circuit breaking, and shapes what the boundary
 * layer sends back when they fail.
 *
 * <p>Breakers for external services are keyed {@code external-<serviceKey>}; boundary
 * handlers wrapped by {@link #withRecovery} use the operation name, by default derived from
 * the request route.</p>
 */
public final class OutboundCallRecovery {

    private static final Logger LOG = LogManager.getLogger(OutboundCallRecovery.class);

    static final String EXTERNAL_KEY_PREFIX = "external-";
    public static final String DEFAULT_DEGRADED_MESSAGE = "Service temporarily unavailable";
    public static final String CIRCUIT_OPEN_MESSAGE = "Service temporarily unavailable due to high error rate";
    public static final String FALLBACK_MESSAGE = "Using cached or fallback data due to service issues";
    public static final String INTERNAL_ERROR_CODE = "INTERNAL_SERVER_ERROR";

    private final ErrorRecovery recovery;
    private final RecoverySettings settings;
    private final SignatureFailureClassifier classifier = SignatureFailureClassifier.network();
    private final MessageSanitizer sanitizer = new MessageSanitizer();

    public OutboundCallRecovery(ErrorRecovery recovery) {
        this(recovery, RecoverySettings.outbound());
    }

    public OutboundCallRecovery(ErrorRecovery recovery, RecoverySettings settings) {
        this.recovery = Objects.requireNonNull(recovery, "recovery must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public <T> CompletableFuture<T> executeExternalCall(String serviceKey, AsyncOperation<T> call) {
        return executeExternalCall(serviceKey, call, OutboundOptions.defaults(), null);
    }

    public <T> CompletableFuture<T> executeExternalCall(String serviceKey, AsyncOperation<T> call,
                                                        OutboundOptions options) {
        return executeExternalCall(serviceKey, call, options, null);
    }

    /**
     * Calls an external service under the breaker {@code external-<serviceKey>}.
     *
     * @param fallback served while the breaker rejects calls (may be null)
     */
    public <T> CompletableFuture<T> executeExternalCall(String serviceKey, AsyncOperation<T> call,
                                                        OutboundOptions options, Fallback<T> fallback) {
        Objects.requireNonNull(serviceKey, "serviceKey must not be null");
        Objects.requireNonNull(options, "options must not be null");
        String key = EXTERNAL_KEY_PREFIX + serviceKey;

        RetryListener logging = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                LOG.warn("External call retry attempt {} for [{}]: {}", attemptNumber, serviceKey, error.getMessage());
            }

            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                LOG.error("External call failed after {} attempts for [{}]: {}",
                        totalAttempts, serviceKey, error.getMessage(), error);
            }
        };

        RecoveryOptions<T> recoveryOptions = this.<T>recoveryOptions(key, options, logging).toBuilder()
                .fallback(fallback)
                .build();
        return recovery.withFullRecovery(key, call, recoveryOptions);
    }

    /**
     * Wraps a boundary handler. The returned future always resolves to a response: the
     * handler's own, or one built by {@link #toResponse} from its final error.
     */
    public CompletableFuture<BoundaryResponse> withRecovery(String operationName,
                                                            AsyncOperation<BoundaryResponse> handler,
                                                            ErrorContext context,
                                                            OutboundOptions options) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(options, "options must not be null");
        String key = operationName != null ? operationName : context.operationName();
        OutboundOptions effective = options.withOperationName(key);

        RetryListener logging = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                LOG.warn("Boundary retry attempt {} for [{}] {} {} (request {}): {}",
                        attemptNumber, key, context.method(), context.route(), context.requestId(), error.getMessage());
            }

            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                LOG.error("Boundary operation [{}] failed after {} attempts, {} {} (request {}): {}",
                        key, totalAttempts, context.method(), context.route(), context.requestId(), error.getMessage());
            }
        };

        return recovery.withFullRecovery(key, handler, this.<BoundaryResponse>recoveryOptions(key, effective, logging))
                .handle((response, error) -> error == null
                        ? response
                        : toResponse(SignatureFailureClassifier.unwrap(error), context, effective));
    }

    /**
     * Turns a final error into a response: fallback data if graceful degradation has some,
     * a degraded 503 if a breaker rejected the call, otherwise a sanitized error.
     */
    public BoundaryResponse toResponse(Throwable error, ErrorContext context, OutboundOptions options) {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(options, "options must not be null");
        String key = options.operationName() != null ? options.operationName() : context.operationName();

        if (options.gracefulDegradation() && options.fallbackData() != null) {
            LOG.warn("Using graceful degradation for [{}] (request {}): {}", key, context.requestId(), error.getMessage());
            recovery.reportDegraded(key, DegradedModeSignal.BOUNDARY_FALLBACK);
            return BoundaryResponse.degraded(200, true, FALLBACK_MESSAGE, options.fallbackData(), context.isoTimestamp());
        }

        if (error instanceof CircuitOpenException) {
            recovery.reportDegraded(key, DegradedModeSignal.CIRCUIT_OPEN);
            return createDegradedResponse(CIRCUIT_OPEN_MESSAGE, options.fallbackData());
        }

        return createErrorResponse(error, context);
    }

    public BoundaryResponse createDegradedResponse(String message, Object partialData) {
        return createDegradedResponse(message, partialData, 503);
    }

    /**
     * Builds a response flagged as degraded. Clients must not treat its data as authoritative.
     */
    public BoundaryResponse createDegradedResponse(String message, Object partialData, int status) {
        String text = message == null ? DEFAULT_DEGRADED_MESSAGE : message;
        return BoundaryResponse.degraded(status, false, text, partialData,
                OpReporterUtils.formatTimestamp(Instant.now()));
    }

    public BoundaryResponse createErrorResponse(Throwable error, ErrorContext context) {
        return createErrorResponse(error, context, 500);
    }

    /**
     * Builds a failure response. Its message is sanitized: no internal detail reaches the client.
     */
    public BoundaryResponse createErrorResponse(Throwable error, ErrorContext context, int status) {
        Objects.requireNonNull(context, "context must not be null");
        LOG.error("Request {} {} {} failed: {}", context.requestId(), context.method(), context.route(),
                error == null ? "unknown error" : error.toString());
        BoundaryResponse.ErrorBody body = new BoundaryResponse.ErrorBody(
                sanitizer.sanitize(error), INTERNAL_ERROR_CODE, context.isoTimestamp(), context.requestId());
        return BoundaryResponse.error(status, body);
    }

    public OutboundStats getStats() {
        return new OutboundStats(recovery.getCircuitBreakerStats(), classifier.signatures(), settings);
    }

    /**
     * Resets every circuit breaker.
     */
    public void reset() {
        recovery.resetAllCircuitBreakers();
    }

    private <T> RecoveryOptions<T> recoveryOptions(String key, OutboundOptions options, RetryListener logging) {
        int maxRetries = options.maxRetries() != null ? options.maxRetries() : settings.maxRetries();
        RetryPolicy policy = RetryPolicy.of(key, maxRetries, settings.backoff()).withClassifier(classifier);
        return RecoveryOptions.<T>builder()
                .retryPolicy(policy)
                .circuitBreaker(options.circuitBreaker() != null ? options.circuitBreaker() : settings.toCircuitBreakerConfig())
                .listener(logging.andThen(options.listener()))
                .build();
    }
}
