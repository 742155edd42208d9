package org.javai.resilience.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.Failure;
import org.javai.resilience.FailureCode;
import org.javai.resilience.FailureKind;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.AsyncOperation;
import org.javai.resilience.boundary.FailureClassifier;
import org.javai.resilience.boundary.SignatureFailureClassifier;
import org.javai.resilience.ops.OpReporter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Runs an asynchronous operation up to {@code maxRetries + 1} times.
 *
 * <p>Between attempts the error is classified: a terminal error ends the sequence at once,
 * a retryable one waits for the policy's backoff delay and tries again. The only points
 * where the sequence waits are the operation's own stage and the backoff delay; cancelling
 * the returned future cancels a pending delay and stops further attempts.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .scheduler(scheduler)
 *     .reporter(reporter)
 *     .build();
 *
 * CompletableFuture<User> user = retrier.withRetry(
 *     "UserApi.fetch",
 *     () -> userApi.fetchAsync(userId),
 *     RetryPolicy.exponentialBackoff("user-api", 2, Duration.ofMillis(100), Duration.ofSeconds(2)),
 *     RetryListener.noOp()
 * );
 * }</pre>
 */
public final class Retrier {

    private static final Logger LOG = LogManager.getLogger(Retrier.class);

    private final FailureClassifier classifier;
    private final OpReporter reporter;
    private final DelayScheduler scheduler;

    private Retrier(FailureClassifier classifier, OpReporter reporter, DelayScheduler scheduler) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private FailureClassifier classifier = SignatureFailureClassifier.defaults();
        private OpReporter reporter = OpReporter.noOp();
        private DelayScheduler scheduler;

        private Builder() {}

        /**
         * Sets the classifier used when a policy does not override it (optional).
         *
         * @param classifier the default classifier
         * @return this builder
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the scheduler that produces backoff delays (required).
         *
         * @param scheduler the delay scheduler
         * @return this builder
         */
        public Builder scheduler(DelayScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         * @throws NullPointerException if the scheduler has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(scheduler, "scheduler must be set");
            return new Retrier(classifier, reporter, scheduler);
        }
    }

    /**
     * Runs the operation with retries and resolves to the value, or fails with the last error.
     *
     * @param operation The operation name for reporting
     * @param work The operation
     * @param policy How many retries, with which delays and classifier
     * @param listener Call-site hooks
     * @return the value of the first successful attempt
     */
    public <T> CompletableFuture<T> withRetry(String operation, AsyncOperation<T> work,
                                              RetryPolicy policy, RetryListener listener) {
        CompletableFuture<Outcome<T>> outcome = execute(operation, work, policy, listener);
        CompletableFuture<T> result = new CompletableFuture<>();
        outcome.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else if (value instanceof Outcome.Fail<T> fail) {
                result.completeExceptionally(fail.failure().exception());
            } else {
                result.complete(value.getOrThrow());
            }
        });
        cancelWith(result, outcome);
        return result;
    }

    /**
     * Runs the operation with retries and resolves to an {@link Outcome}; the returned
     * future itself only fails if it is cancelled.
     *
     * @param operation The operation name for reporting
     * @param work The operation
     * @param policy How many retries, with which delays and classifier
     * @param listener Call-site hooks
     * @return Ok with the value, or Fail with the final failure; both carry the attempt count
     */
    public <T> CompletableFuture<Outcome<T>> execute(String operation, AsyncOperation<T> work,
                                                     RetryPolicy policy, RetryListener listener) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        Sequence<T> sequence = new Sequence<>(operation, work, policy, listener);
        sequence.attempt(1);
        return sequence.result;
    }

    /**
     * Cancels {@code upstream} when {@code downstream} is cancelled.
     */
    static void cancelWith(CompletableFuture<?> downstream, CompletableFuture<?> upstream) {
        downstream.whenComplete((ignored, error) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(false);
            }
        });
    }

    private final class Sequence<T> {
        private final String operation;
        private final AsyncOperation<T> work;
        private final RetryPolicy policy;
        private final RetryListener listener;
        private final FailureClassifier effectiveClassifier;
        private final CompletableFuture<Outcome<T>> result = new CompletableFuture<>();
        private volatile CompletableFuture<?> pending;

        private Sequence(String operation, AsyncOperation<T> work, RetryPolicy policy, RetryListener listener) {
            this.operation = operation;
            this.work = work;
            this.policy = policy;
            this.listener = listener;
            this.effectiveClassifier = policy.classifierOverride().orElse(classifier);
            result.whenComplete((ignored, error) -> {
                CompletableFuture<?> inFlight = pending;
                if (result.isCancelled() && inFlight != null) {
                    inFlight.cancel(false);
                }
            });
        }

        private void attempt(int attemptNumber) {
            if (result.isDone()) {
                return;
            }
            CompletableFuture<T> stage = invoke();
            pending = stage;
            stage.whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(Outcome.ok(value, attemptNumber));
                } else {
                    onFailure(attemptNumber, SignatureFailureClassifier.unwrap(error));
                }
            });
        }

        private CompletableFuture<T> invoke() {
            try {
                CompletionStage<T> stage = work.execute();
                if (stage == null) {
                    return CompletableFuture.failedFuture(
                            new IllegalStateException("operation [" + operation + "] returned no stage"));
                }
                return stage.toCompletableFuture();
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void onFailure(int attemptNumber, Throwable error) {
            if (result.isDone()) {
                return;
            }
            FailureKind kind;
            RetryDecision decision;
            try {
                kind = effectiveClassifier.classify(error);
                decision = policy.decide(attemptNumber, kind.type());
            } catch (RuntimeException decisionError) {
                LOG.warn("Could not decide on retry for [{}], giving up: {}", operation, decisionError.toString());
                giveUp(Failure.terminalFailure(FailureCode.of("retry", "decision_failed"),
                        "Retry decision failed: " + decisionError.getMessage(), operation, error), attemptNumber, false);
                return;
            }
            Failure failure = Failure.of(kind, operation, error);

            if (decision instanceof RetryDecision.Retry retry) {
                notifyRetry(attemptNumber, error);
                safely("reportRetryAttempt", () -> reporter.reportRetryAttempt(failure, attemptNumber, retry.delay(), policy.id()));
                CompletableFuture<Void> wait;
                try {
                    wait = scheduler.delay(retry.delay());
                } catch (RuntimeException schedulerError) {
                    LOG.warn("Could not schedule retry for [{}]: {}", operation, schedulerError.toString());
                    giveUp(failure, attemptNumber, true);
                    return;
                }
                pending = wait;
                wait.whenComplete((ignored, waitError) -> {
                    if (waitError == null) {
                        attempt(attemptNumber + 1);
                    } else if (!result.isDone()) {
                        // The scheduler was torn down while we waited
                        giveUp(failure, attemptNumber, true);
                    }
                });
                return;
            }

            giveUp(failure, attemptNumber, kind.isRetryable());
        }

        private void giveUp(Failure failure, int totalAttempts, boolean exhausted) {
            if (exhausted) {
                safely("reportRetryExhausted", () -> reporter.reportRetryExhausted(failure, totalAttempts, policy.id()));
            } else {
                safely("report", () -> reporter.report(failure));
            }
            notifyFailure(failure.exception(), totalAttempts);
            result.complete(Outcome.fail(failure, totalAttempts));
        }

        private void notifyRetry(int attemptNumber, Throwable error) {
            safely("onRetry", () -> listener.onRetry(attemptNumber, error));
        }

        private void notifyFailure(Throwable error, int totalAttempts) {
            safely("onFailure", () -> listener.onFailure(error, totalAttempts));
        }

        private void safely(String hook, Runnable call) {
            try {
                call.run();
            } catch (RuntimeException e) {
                LOG.warn("{} failed for [{}]: {}", hook, operation, e.toString());
            }
        }
    }
}
