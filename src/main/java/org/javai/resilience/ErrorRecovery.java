package org.javai.resilience;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.boundary.AsyncOperation;
import org.javai.resilience.boundary.FailureClassifier;
import org.javai.resilience.boundary.SignatureFailureClassifier;
import org.javai.resilience.circuit.CircuitBreakerConfig;
import org.javai.resilience.circuit.CircuitBreakerRegistry;
import org.javai.resilience.circuit.CircuitBreakerState;
import org.javai.resilience.circuit.CircuitOpenException;
import org.javai.resilience.circuit.Permit;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.ops.log4j.Log4jOpReporter;
import org.javai.resilience.retry.DelayScheduler;
import org.javai.resilience.retry.Retrier;
import org.javai.resilience.retry.RetryPolicy;
import org.javai.resilience.retry.ScheduledDelayScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * The single entry point most callers use: circuit breaking around retries, with an
 * optional fallback.
 *
 * <p>The breaker decides whether a whole retry sequence may run at all. Retries absorb
 * transient blips; only the sequence's final outcome is reported to the breaker, so one
 * exhausted sequence counts as one breaker failure. A terminal error ends the sequence at
 * once and also counts as one failure.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (ErrorRecovery recovery = ErrorRecovery.create()) {
 *     CompletableFuture<List<Track>> tracks = recovery.withFullRecovery(
 *         "catalog-tracks",
 *         () -> catalog.fetchTracksAsync(),
 *         RecoveryOptions.withFallback(List.of())
 *     );
 * }
 * }</pre>
 */
public final class ErrorRecovery implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ErrorRecovery.class);

    private final RecoverySettings settings;
    private final CircuitBreakerRegistry registry;
    private final Retrier retrier;
    private final OpReporter reporter;
    private final DelayScheduler scheduler;
    private final AutoCloseable ownedScheduler;

    private ErrorRecovery(Builder builder) {
        this.settings = builder.settings;
        this.reporter = builder.reporter;
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownedScheduler = null;
        } else {
            ScheduledDelayScheduler owned = new ScheduledDelayScheduler();
            this.scheduler = owned;
            this.ownedScheduler = owned;
        }
        this.registry = new CircuitBreakerRegistry(builder.clock, reporter);
        this.retrier = Retrier.builder()
                .classifier(builder.classifier)
                .reporter(reporter)
                .scheduler(scheduler)
                .build();
    }

    /**
     * Creates an instance with default settings that logs through Log4j.
     */
    public static ErrorRecovery create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RecoverySettings settings = RecoverySettings.defaults();
        private FailureClassifier classifier = SignatureFailureClassifier.defaults();
        private OpReporter reporter = new Log4jOpReporter();
        private DelayScheduler scheduler;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder settings(RecoverySettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the scheduler for backoff delays and timeouts. A scheduler passed here is not
         * closed by {@link ErrorRecovery#close()}; without one, an owned scheduler is created.
         */
        public Builder scheduler(DelayScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
            return this;
        }

        /**
         * Sets the clock breakers use for cooldowns.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ErrorRecovery build() {
            return new ErrorRecovery(this);
        }
    }

    /**
     * Runs the operation with retries only; no breaker is consulted.
     * Resolves to the value or fails with the last error itself.
     */
    public <T> CompletableFuture<T> withRetry(String operation, AsyncOperation<T> work, RecoveryOptions<T> options) {
        Objects.requireNonNull(options, "options must not be null");
        return retrier.withRetry(operation, work, policyFor(operation, options), options.listener());
    }

    /**
     * Runs the operation once under the breaker for {@code key}.
     *
     * <p>While the breaker rejects calls the operation is not invoked: the future resolves
     * to the fallback if one is configured, otherwise it fails with {@link CircuitOpenException}.
     */
    public <T> CompletableFuture<T> withCircuitBreaker(String key, AsyncOperation<T> work, RecoveryOptions<T> options) {
        Objects.requireNonNull(options, "options must not be null");
        RetryPolicy single = policyFor(key, options).withMaxRetries(0);
        return unwrap(guarded(key, options,
                () -> retrier.execute(key, work, single, options.listener())));
    }

    /**
     * Runs the operation with retries under the breaker for {@code key}.
     */
    public <T> CompletableFuture<T> withFullRecovery(String key, AsyncOperation<T> work, RecoveryOptions<T> options) {
        return unwrap(attempt(key, work, options));
    }

    /**
     * Like {@link #withFullRecovery}, but resolves to an {@link Outcome} instead of failing.
     * A rejected call without a fallback is a {@code Fail} with zero attempts; a served
     * fallback is an {@code Ok}.
     */
    public <T> CompletableFuture<Outcome<T>> attempt(String key, AsyncOperation<T> work, RecoveryOptions<T> options) {
        Objects.requireNonNull(options, "options must not be null");
        RetryPolicy policy = policyFor(key, options);
        return guarded(key, options, () -> retrier.execute(key, work, policy, options.listener()));
    }

    /**
     * Returns a snapshot of every breaker, sorted by key.
     */
    public Map<String, CircuitBreakerState> getCircuitBreakerStats() {
        return registry.snapshot();
    }

    public void resetAllCircuitBreakers() {
        registry.resetAll();
    }

    public void resetCircuitBreaker(String key) {
        registry.reset(key);
    }

    public RecoverySettings settings() {
        return settings;
    }

    public OpReporter reporter() {
        return reporter;
    }

    public DelayScheduler scheduler() {
        return scheduler;
    }

    /**
     * Reports a served fallback. Reporter errors are logged, never thrown.
     */
    public void reportDegraded(String key, String reason) {
        try {
            reporter.reportDegraded(DegradedModeSignal.now(key, reason));
        } catch (RuntimeException e) {
            LOG.warn("reportDegraded failed for [{}]: {}", key, e.toString());
        }
    }

    /**
     * Closes the scheduler this instance created, cancelling pending backoff delays.
     */
    @Override
    public void close() {
        if (ownedScheduler == null) {
            return;
        }
        try {
            ownedScheduler.close();
        } catch (Exception e) {
            LOG.warn("Failed to close scheduler: {}", e.toString());
        }
    }

    private <T> CompletableFuture<Outcome<T>> guarded(String key, RecoveryOptions<T> options,
                                                      Supplier<CompletableFuture<Outcome<T>>> body) {
        Objects.requireNonNull(key, "key must not be null");
        CircuitBreakerConfig config = options.circuitBreakerOverride().orElseGet(settings::toCircuitBreakerConfig);

        Permit permit;
        try {
            permit = registry.acquire(key, config);
        } catch (CircuitOpenException rejected) {
            try {
                return CompletableFuture.completedFuture(rejectedOutcome(key, rejected, options));
            } catch (RuntimeException fallbackError) {
                return CompletableFuture.failedFuture(fallbackError);
            }
        }

        // A permit is handed back exactly once, whichever of outcome or cancellation comes first
        AtomicBoolean settled = new AtomicBoolean();
        CompletableFuture<Outcome<T>> inner;
        try {
            inner = body.get();
        } catch (RuntimeException e) {
            settle(settled, () -> registry.release(permit));
            throw e;
        }

        CompletableFuture<Outcome<T>> result = new CompletableFuture<>();
        inner.whenComplete((outcome, error) -> {
            if (error != null) {
                // Only cancellation fails the outcome stage
                settle(settled, () -> registry.release(permit));
                result.completeExceptionally(error);
                return;
            }
            if (outcome.isOk()) {
                settle(settled, () -> registry.onSuccess(permit));
                result.complete(outcome);
                return;
            }
            settle(settled, () -> registry.onFailure(permit));
            try {
                result.complete(afterFailure(key, (Outcome.Fail<T>) outcome, options));
            } catch (RuntimeException fallbackError) {
                result.completeExceptionally(fallbackError);
            }
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                settle(settled, () -> registry.release(permit));
                inner.cancel(false);
            }
        });
        return result;
    }

    private static void settle(AtomicBoolean settled, Runnable handback) {
        if (settled.compareAndSet(false, true)) {
            handback.run();
        }
    }

    private <T> Outcome<T> rejectedOutcome(String key, CircuitOpenException rejected, RecoveryOptions<T> options) {
        if (options.fallback() != null) {
            LOG.debug("Circuit [{}] is {}, serving fallback", key, rejected.state());
            reportDegraded(key, DegradedModeSignal.CIRCUIT_OPEN);
            return Outcome.ok(options.fallback().get(), 0);
        }
        LOG.debug("Circuit [{}] is {}, rejecting call", key, rejected.state());
        Failure failure = Failure.terminalFailure(
                FailureCode.of("circuit", "open"), rejected.getMessage(), key, rejected);
        return Outcome.fail(failure, 0);
    }

    private <T> Outcome<T> afterFailure(String key, Outcome.Fail<T> failed, RecoveryOptions<T> options) {
        boolean exhausted = failed.failure().isRetryable();
        if (exhausted && options.fallbackOnExhaustion() && options.fallback() != null) {
            reportDegraded(key, DegradedModeSignal.RETRIES_EXHAUSTED);
            return Outcome.ok(options.fallback().get(), failed.attempts());
        }
        return failed;
    }

    private <T> RetryPolicy policyFor(String id, RecoveryOptions<T> options) {
        return options.retryPolicyOverride().orElseGet(() -> settings.toRetryPolicy(id));
    }

    private static <T> CompletableFuture<T> unwrap(CompletableFuture<Outcome<T>> outcome) {
        CompletableFuture<T> result = new CompletableFuture<>();
        outcome.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else if (value instanceof Outcome.Fail<T> fail) {
                result.completeExceptionally(failureCause(fail.failure()));
            } else {
                result.complete(value.getOrThrow());
            }
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                outcome.cancel(false);
            }
        });
        return result;
    }

    private static Throwable failureCause(Failure failure) {
        return failure.exception() != null
                ? failure.exception()
                : new OutcomeFailedException(failure, 0);
    }
}
