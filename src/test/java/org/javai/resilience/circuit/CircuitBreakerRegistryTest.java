package org.javai.resilience.circuit;

import org.javai.resilience.fixtures.MutableClock;
import org.javai.resilience.fixtures.RecordingReporter;
import org.javai.resilience.fixtures.RecordingReporter.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private static final CircuitBreakerConfig CONFIG = CircuitBreakerConfig.of(3, Duration.ofSeconds(30));

    private MutableClock clock;
    private RecordingReporter reporter;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-20T10:00:00Z"));
        reporter = new RecordingReporter();
        registry = new CircuitBreakerRegistry(clock, reporter);
    }

    @Test
    @DisplayName("Opens after exactly threshold consecutive failures")
    void opensAtThreshold() {
        recordFailures(2);
        assertThat(state("svc").state()).isEqualTo(CircuitState.CLOSED);
        assertThat(state("svc").consecutiveFailures()).isEqualTo(2);

        recordFailures(1);

        CircuitBreakerState open = state("svc");
        assertThat(open.state()).isEqualTo(CircuitState.OPEN);
        assertThat(open.openedAt()).isEqualTo(clock.instant());
        assertThat(reporter.transitions).containsExactly(new Transition("svc", CircuitState.CLOSED, CircuitState.OPEN));
    }

    @Test
    void successResetsFailureCount() {
        recordFailures(2);
        registry.onSuccess(registry.acquire("svc", CONFIG));
        recordFailures(2);

        assertThat(state("svc").state()).isEqualTo(CircuitState.CLOSED);
        assertThat(state("svc").consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void openRejectsUntilCooldownElapses() {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(29));

        assertThatThrownBy(() -> registry.acquire("svc", CONFIG))
                .isInstanceOfSatisfying(CircuitOpenException.class, e -> {
                    assertThat(e.key()).isEqualTo("svc");
                    assertThat(e.state()).isEqualTo(CircuitState.OPEN);
                    assertThat(e.retryAt()).isEqualTo(Instant.parse("2024-01-20T10:00:30Z"));
                    assertThat(e.getMessage()).isEqualTo("Circuit breaker is OPEN for [svc]");
                });
    }

    @Test
    void afterCooldown_admitsSingleProbe() {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(30));

        Permit probe = registry.acquire("svc", CONFIG);

        assertThat(probe.probe()).isTrue();
        assertThat(state("svc").state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThatThrownBy(() -> registry.acquire("svc", CONFIG))
                .isInstanceOfSatisfying(CircuitOpenException.class,
                        e -> assertThat(e.state()).isEqualTo(CircuitState.HALF_OPEN));
    }

    @Test
    void probeSuccess_closesAndResetsCounters() {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(30));

        registry.onSuccess(registry.acquire("svc", CONFIG));

        CircuitBreakerState closed = state("svc");
        assertThat(closed.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(closed.consecutiveFailures()).isZero();
        assertThat(closed.openedAt()).isNull();
        assertThat(reporter.transitions).extracting(Transition::to)
                .containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED);
    }

    @Test
    void probeFailure_reopensAndRestartsCooldown() {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(45));

        registry.onFailure(registry.acquire("svc", CONFIG));

        CircuitBreakerState reopened = state("svc");
        assertThat(reopened.state()).isEqualTo(CircuitState.OPEN);
        assertThat(reopened.openedAt()).isEqualTo(clock.instant());
        clock.advance(Duration.ofSeconds(29));
        assertThatThrownBy(() -> registry.acquire("svc", CONFIG)).isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void releasedProbe_letsNextCallerProbeAtOnce() {
        recordFailures(3);
        Instant openedAt = clock.instant();
        clock.advance(Duration.ofSeconds(30));

        registry.release(registry.acquire("svc", CONFIG));

        assertThat(state("svc").state()).isEqualTo(CircuitState.OPEN);
        assertThat(state("svc").openedAt()).isEqualTo(openedAt);
        assertThat(registry.acquire("svc", CONFIG).probe()).isTrue();
    }

    @Test
    void stalePermitFromEarlierHalfOpenCall_isIgnored() {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(30));
        Permit first = registry.acquire("svc", CONFIG);
        registry.release(first);
        Permit second = registry.acquire("svc", CONFIG);

        registry.release(first);
        registry.onFailure(first);
        registry.onSuccess(first);

        assertThat(second.probeSequence()).isGreaterThan(first.probeSequence());
        assertThat(state("svc").state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThatThrownBy(() -> registry.acquire("svc", CONFIG)).isInstanceOf(CircuitOpenException.class);

        registry.onSuccess(second);

        assertThat(state("svc").state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void outcomesFromBeforeReset_areIgnored() {
        Permit stale = registry.acquire("svc", CONFIG);
        recordFailures(2);

        registry.reset("svc");
        registry.onFailure(stale);

        assertThat(state("svc").consecutiveFailures()).isZero();
        assertThat(state("svc").epoch()).isEqualTo(1L);
    }

    @Test
    void resetAll_closesEveryBreaker() {
        recordFailures(3);
        registry.onFailure(registry.acquire("other", CONFIG));

        registry.resetAll();

        assertThat(registry.snapshot()).containsOnlyKeys("other", "svc");
        assertThat(registry.snapshot().values()).allSatisfy(s -> {
            assertThat(s.state()).isEqualTo(CircuitState.CLOSED);
            assertThat(s.consecutiveFailures()).isZero();
        });
        assertThat(reporter.transitions).last()
                .isEqualTo(new Transition("svc", CircuitState.OPEN, CircuitState.CLOSED));
    }

    @Test
    void configOnlyAppliesWhenBreakerIsCreated() {
        registry.acquire("svc", CONFIG);
        registry.acquire("svc", CircuitBreakerConfig.of(1, Duration.ofSeconds(1)));

        assertThat(state("svc").failureThreshold()).isEqualTo(3);
    }

    @Test
    @DisplayName("Concurrent failures report the opening transition once")
    void concurrentFailures_openOnce() throws Exception {
        int threads = 16;
        CircuitBreakerConfig config = CircuitBreakerConfig.of(4, Duration.ofSeconds(30));
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                Permit permit = registry.acquire("svc", config);
                pool.execute(() -> {
                    try {
                        start.await();
                        registry.onFailure(permit);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(state("svc").state()).isEqualTo(CircuitState.OPEN);
        assertThat(reporter.transitions).containsExactly(new Transition("svc", CircuitState.CLOSED, CircuitState.OPEN));
    }

    @Test
    @DisplayName("Only one concurrent caller becomes the probe")
    void concurrentCallers_singleProbe() throws Exception {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(30));

        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger probes = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        if (registry.acquire("svc", CONFIG).probe()) {
                            probes.incrementAndGet();
                        }
                    } catch (CircuitOpenException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(probes.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(threads - 1);
    }

    private void recordFailures(int times) {
        for (int i = 0; i < times; i++) {
            registry.onFailure(registry.acquire("svc", CONFIG));
        }
    }

    private CircuitBreakerState state(String key) {
        return registry.state(key).orElseThrow();
    }
}
