package org.javai.resilience.circuit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.ops.OpReporter;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-key circuit breakers, created lazily on first use and never removed, only reset.
 *
 * <h2>Thread safety</h2>
 * Each key owns an {@link AtomicReference} to an immutable {@link CircuitBreakerState}.
 * Every transition is a compare-and-set from the snapshot the caller observed, so:
 * <ul>
 *   <li>when several callers fail at once, exactly one CAS moves CLOSED to OPEN and only
 *       that caller reports the transition;</li>
 *   <li>when the cooldown has elapsed, exactly one caller wins OPEN to HALF_OPEN and becomes
 *       the probe; everyone else is rejected until the probe resolves;</li>
 *   <li>an outcome that no longer matches the observed state, the epoch of a reset or the
 *       current probe number is dropped, which makes reporting the same outcome twice
 *       harmless.</li>
 * </ul>
 *
 * <h2>State machine</h2>
 * <pre>
 *     CLOSED ──(failures &gt;= threshold)──&gt; OPEN
 *        ^                                  │
 *        │                          (cooldown elapsed,
 *  (probe success)                    next caller probes)
 *        │                                  │
 *        └──────── HALF_OPEN &lt;──────────────┘
 *                     │
 *              (probe failure, cooldown restarts)
 *                     └──────&gt; OPEN
 * </pre>
 */
public final class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<String, AtomicReference<CircuitBreakerState>> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final OpReporter reporter;

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC(), OpReporter.noOp());
    }

    public CircuitBreakerRegistry(OpReporter reporter) {
        this(Clock.systemUTC(), reporter);
    }

    public CircuitBreakerRegistry(Clock clock, OpReporter reporter) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Asks to run an operation under the breaker for {@code key}.
     *
     * <p>The config only applies when this call creates the breaker; an existing breaker
     * keeps the thresholds it was created with until the process ends.
     *
     * @return a permit to hand back with the outcome
     * @throws CircuitOpenException if the breaker is OPEN within its cooldown, or HALF_OPEN
     */
    public Permit acquire(String key, CircuitBreakerConfig config) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(config, "config must not be null");
        AtomicReference<CircuitBreakerState> ref =
                breakers.computeIfAbsent(key, k -> new AtomicReference<>(CircuitBreakerState.initial(k, config)));

        while (true) {
            CircuitBreakerState current = ref.get();

            if (current.state() == CircuitState.CLOSED) {
                return new Permit(key, current.epoch(), 0L);
            }

            if (current.state() == CircuitState.HALF_OPEN) {
                throw new CircuitOpenException(key, CircuitState.HALF_OPEN, current.probeAllowedAt());
            }

            if (!current.cooldownElapsed(clock.instant())) {
                throw new CircuitOpenException(key, CircuitState.OPEN, current.probeAllowedAt());
            }

            // Only the caller whose CAS succeeds becomes the probe
            CircuitBreakerState probing = current.toHalfOpen();
            if (ref.compareAndSet(current, probing)) {
                reportTransition(key, CircuitState.OPEN, CircuitState.HALF_OPEN);
                return new Permit(key, current.epoch(), probing.probeSequence());
            }
        }
    }

    /**
     * Records a successful call. Closes the breaker after a probe, otherwise clears the failure count.
     */
    public void onSuccess(Permit permit) {
        AtomicReference<CircuitBreakerState> ref = refFor(permit);
        if (ref == null) {
            return;
        }
        while (true) {
            CircuitBreakerState current = ref.get();
            if (current.epoch() != permit.epoch()) {
                return;
            }
            if (permit.probe()) {
                if (!isCurrentProbe(current, permit)) {
                    return;
                }
                if (ref.compareAndSet(current, current.toClosed())) {
                    reportTransition(permit.key(), CircuitState.HALF_OPEN, CircuitState.CLOSED);
                    return;
                }
            } else {
                if (current.state() != CircuitState.CLOSED || current.consecutiveFailures() == 0) {
                    return;
                }
                if (ref.compareAndSet(current, current.toClosed())) {
                    return;
                }
            }
        }
    }

    /**
     * Records a failed call. A failed probe reopens the breaker and restarts the cooldown;
     * otherwise the failure count grows and the breaker opens at the threshold.
     */
    public void onFailure(Permit permit) {
        AtomicReference<CircuitBreakerState> ref = refFor(permit);
        if (ref == null) {
            return;
        }
        while (true) {
            CircuitBreakerState current = ref.get();
            if (current.epoch() != permit.epoch()) {
                return;
            }
            Instant now = clock.instant();
            if (permit.probe()) {
                if (!isCurrentProbe(current, permit)) {
                    return;
                }
                if (ref.compareAndSet(current, current.toOpen(now))) {
                    reportTransition(permit.key(), CircuitState.HALF_OPEN, CircuitState.OPEN);
                    return;
                }
            } else {
                // Another caller already opened it; our failure adds nothing
                if (current.state() != CircuitState.CLOSED) {
                    return;
                }
                CircuitBreakerState next = current.withFailure(now);
                if (ref.compareAndSet(current, next)) {
                    if (next.state() == CircuitState.OPEN) {
                        reportTransition(permit.key(), CircuitState.CLOSED, CircuitState.OPEN);
                    }
                    return;
                }
            }
        }
    }

    /**
     * Hands back a permit whose call was cancelled before it produced an outcome.
     * A cancelled probe returns the breaker to OPEN with its original {@code openedAt},
     * so the next caller may probe at once.
     */
    public void release(Permit permit) {
        AtomicReference<CircuitBreakerState> ref = refFor(permit);
        if (ref == null || !permit.probe()) {
            return;
        }
        while (true) {
            CircuitBreakerState current = ref.get();
            if (current.epoch() != permit.epoch() || !isCurrentProbe(current, permit)) {
                return;
            }
            if (ref.compareAndSet(current, current.toOpen(current.openedAt()))) {
                reportTransition(permit.key(), CircuitState.HALF_OPEN, CircuitState.OPEN);
                return;
            }
        }
    }

    /**
     * Returns the current snapshot for {@code key}, if that breaker exists.
     */
    public Optional<CircuitBreakerState> state(String key) {
        AtomicReference<CircuitBreakerState> ref = breakers.get(key);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    /**
     * Returns a snapshot of every breaker, sorted by key.
     */
    public Map<String, CircuitBreakerState> snapshot() {
        Map<String, CircuitBreakerState> stats = new TreeMap<>();
        breakers.forEach((key, ref) -> stats.put(key, ref.get()));
        return Collections.unmodifiableMap(stats);
    }

    /**
     * Forces the breaker for {@code key} back to CLOSED with no failures.
     * Outcomes of calls admitted before the reset are ignored.
     */
    public void reset(String key) {
        AtomicReference<CircuitBreakerState> ref = breakers.get(key);
        if (ref == null) {
            return;
        }
        while (true) {
            CircuitBreakerState current = ref.get();
            if (ref.compareAndSet(current, current.reset())) {
                if (current.state() != CircuitState.CLOSED) {
                    reportTransition(key, current.state(), CircuitState.CLOSED);
                }
                return;
            }
        }
    }

    /**
     * Forces every known breaker back to CLOSED with no failures.
     */
    public void resetAll() {
        for (String key : breakers.keySet()) {
            reset(key);
        }
    }

    // A probe permit only speaks for the probe it was issued to
    private static boolean isCurrentProbe(CircuitBreakerState current, Permit permit) {
        return current.state() == CircuitState.HALF_OPEN && current.probeSequence() == permit.probeSequence();
    }

    private AtomicReference<CircuitBreakerState> refFor(Permit permit) {
        Objects.requireNonNull(permit, "permit must not be null");
        return breakers.get(permit.key());
    }

    private void reportTransition(String key, CircuitState from, CircuitState to) {
        try {
            reporter.reportCircuitTransition(key, from, to);
        } catch (RuntimeException e) {
            LOG.warn("Reporter failed for circuit transition [{}] {} -> {}: {}", key, from, to, e.toString());
        }
    }
}
