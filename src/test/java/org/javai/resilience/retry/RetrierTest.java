package org.javai.resilience.retry;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureCode;
import org.javai.resilience.FailureKind;
import org.javai.resilience.FailureType;
import org.javai.resilience.Outcome;
import org.javai.resilience.TerminalException;
import org.javai.resilience.TransientException;
import org.javai.resilience.fixtures.ManualScheduler;
import org.javai.resilience.fixtures.RecordingReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetrierTest {

    private RecordingReporter reporter;
    private ManualScheduler scheduler;
    private Retrier retrier;

    @BeforeEach
    void setUp() {
        reporter = new RecordingReporter();
        scheduler = ManualScheduler.immediate();
        retrier = Retrier.builder()
                .reporter(reporter)
                .scheduler(scheduler)
                .build();
    }

    @Test
    void withRetry_success_returnsValue() {
        CompletableFuture<String> result = retrier.withRetry("Op",
                () -> CompletableFuture.completedFuture("ok"),
                RetryPolicy.fixed("test", 3, Duration.ofMillis(10)),
                RetryListener.noOp());

        assertThat(result.join()).isEqualTo("ok");
        assertThat(reporter.retries).isEmpty();
        assertThat(scheduler.requested()).isEmpty();
    }

    @Test
    void withRetry_twoTransientFailuresThenSuccess_resolvesOnThirdCall() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> retryNumbers = new ArrayList<>();
        RetryListener listener = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                retryNumbers.add(attemptNumber);
            }
        };

        CompletableFuture<String> result = retrier.withRetry("Op", () -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new TransientException("ECONNRESET", "connection reset"));
            }
            return CompletableFuture.completedFuture("third time");
        }, RetryPolicy.fixed("test", 2, Duration.ofMillis(10)), listener);

        assertThat(result.join()).isEqualTo("third time");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(retryNumbers).containsExactly(1, 2);
        assertThat(reporter.retries).hasSize(2);
    }

    @Test
    void withRetry_alwaysTransient_invokesMaxRetriesPlusOneTimes() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> failureCounts = new ArrayList<>();
        RetryListener listener = new RetryListener() {
            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                failureCounts.add(totalAttempts);
            }
        };
        TransientException error = new TransientException("ETIMEDOUT", "timed out");

        CompletableFuture<String> result = retrier.withRetry("Op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(error);
        }, RetryPolicy.fixed("test", 4, Duration.ofMillis(10)), listener);

        assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .hasCause(error);
        assertThat(calls.get()).isEqualTo(5);
        assertThat(failureCounts).containsExactly(5);
        assertThat(reporter.exhausted).singleElement()
                .satisfies(e -> {
                    assertThat(e.totalAttempts()).isEqualTo(5);
                    assertThat(e.policyId()).isEqualTo("test");
                });
    }

    @Test
    void withRetry_terminalError_abortsWithoutDelay() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> failureCounts = new ArrayList<>();
        RetryListener listener = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                fail("terminal errors must not be retried");
            }

            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                failureCounts.add(totalAttempts);
            }
        };

        CompletableFuture<String> result = retrier.withRetry("Op", () -> {
            calls.incrementAndGet();
            throw new TerminalException("VALIDATION", "title must not be empty");
        }, RetryPolicy.fixed("test", 3, Duration.ofMillis(10)), listener);

        assertThatThrownBy(result::join).hasCauseInstanceOf(TerminalException.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(failureCounts).containsExactly(1);
        assertThat(scheduler.requested()).isEmpty();
        assertThat(reporter.failures).singleElement()
                .satisfies(f -> assertThat(f.type()).isEqualTo(FailureType.TERMINAL));
    }

    @Test
    void withRetry_unknownError_isTerminalByDefault() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = retrier.withRetry("Op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("bug"));
        }, RetryPolicy.fixed("test", 3, Duration.ofMillis(10)), RetryListener.noOp());

        assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void withRetry_waitsBackoffDelayForEachRetry() {
        Backoff backoff = Backoff.exponential(Duration.ofMillis(100), 2.0, Duration.ofMillis(300));

        retrier.withRetry("Op",
                () -> CompletableFuture.failedFuture(new TransientException("ECONNRESET", "reset")),
                RetryPolicy.of("exp", 3, backoff), RetryListener.noOp());

        assertThat(scheduler.requested()).containsExactly(
                Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(300));
    }

    @Test
    void execute_returnsOutcomeWithAttemptCount() {
        AtomicInteger calls = new AtomicInteger();

        Outcome<String> outcome = retrier.execute("Op", () -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new TransientException("ECONNRESET", "reset"));
            }
            return CompletableFuture.completedFuture("done");
        }, RetryPolicy.fixed("test", 2, Duration.ZERO), RetryListener.noOp()).join();

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(outcome.getOrThrow()).isEqualTo("done");
    }

    @Test
    void execute_policyClassifierOverridesDefault() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.fixed("test", 2, Duration.ZERO)
                .withClassifier(error -> FailureKind.transientFailure(
                        FailureCode.of("test", "always"), "always retry"));

        Outcome<String> outcome = retrier.<String>execute("Op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("normally terminal"));
        }, policy, RetryListener.noOp()).join();

        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void execute_throwingClassifier_endsSequenceAsTerminalFailure() {
        AtomicInteger calls = new AtomicInteger();
        TransientException original = new TransientException("ECONNRESET", "reset");
        RetryPolicy policy = RetryPolicy.fixed("test", 3, Duration.ZERO)
                .withClassifier(error -> {
                    throw new IllegalStateException("classifier bug");
                });

        CompletableFuture<Outcome<String>> future = retrier.<String>execute("Op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(original);
        }, policy, RetryListener.noOp());

        assertThat(future).isDone();
        Outcome<String> outcome = future.join();
        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
        Failure failure = ((Outcome.Fail<String>) outcome).failure();
        assertThat(failure.code().toString()).isEqualTo("retry:decision_failed");
        assertThat(failure.exception()).isSameAs(original);
        assertThat(reporter.failures).containsExactly(failure);
    }

    @Test
    void withRetry_subMillisecondJitter_stillRetries() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of("test", 2,
                Backoff.fixed(Duration.ofMillis(10)).withJitter(Duration.ofNanos(500_000)));

        CompletableFuture<String> result = retrier.withRetry("Op", () -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new TransientException("ECONNRESET", "reset"));
            }
            return CompletableFuture.completedFuture("ok");
        }, policy, RetryListener.noOp());

        assertThat(result.join()).isEqualTo("ok");
        assertThat(scheduler.requested()).containsExactly(Duration.ofMillis(10));
    }

    @Test
    void withRetry_throwingListener_doesNotBreakSequence() {
        AtomicInteger calls = new AtomicInteger();
        RetryListener listener = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                throw new RuntimeException("listener bug");
            }
        };

        CompletableFuture<String> result = retrier.withRetry("Op", () -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new TransientException("ECONNRESET", "reset"));
            }
            return CompletableFuture.completedFuture("ok");
        }, RetryPolicy.fixed("test", 1, Duration.ZERO), listener);

        assertThat(result.join()).isEqualTo("ok");
    }

    @Test
    void cancel_duringBackoff_stopsFurtherAttempts() {
        ManualScheduler manual = ManualScheduler.manual();
        Retrier manualRetrier = Retrier.builder().scheduler(manual).build();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = manualRetrier.withRetry("Op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new TransientException("ECONNRESET", "reset"));
        }, RetryPolicy.fixed("test", 3, Duration.ofSeconds(1)), RetryListener.noOp());

        assertThat(manual.pendingCount()).isEqualTo(1);
        result.cancel(false);

        assertThat(manual.pendingCount()).isZero();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void builder_requiresScheduler() {
        assertThatThrownBy(() -> Retrier.builder().build())
                .isInstanceOf(NullPointerException.class);
    }
}
