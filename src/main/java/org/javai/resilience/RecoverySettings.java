package org.javai.resilience;

import org.javai.resilience.circuit.CircuitBreakerConfig;
import org.javai.resilience.ops.OpReporterUtils;
import org.javai.resilience.retry.Backoff;
import org.javai.resilience.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Every tunable of the resilience layer, with documented defaults.
 *
 * <p>Three profiles ship with the library:
 * <table>
 *   <caption>Defaults</caption>
 *   <tr><th></th><th>defaults()</th><th>database()</th><th>outbound()</th></tr>
 *   <tr><td>maxRetries</td><td>3</td><td>3</td><td>2</td></tr>
 *   <tr><td>initialDelay</td><td>1 s</td><td>500 ms</td><td>1 s</td></tr>
 *   <tr><td>backoffMultiplier</td><td>2.0</td><td>2.0</td><td>1.5</td></tr>
 *   <tr><td>maxDelay</td><td>10 s</td><td>5 s</td><td>3 s</td></tr>
 *   <tr><td>maxJitter</td><td>1 s</td><td>1 s</td><td>1 s</td></tr>
 *   <tr><td>failureThreshold</td><td>5</td><td>5</td><td>10</td></tr>
 *   <tr><td>cooldown</td><td>60 s</td><td>30 s</td><td>60 s</td></tr>
 *   <tr><td>queryTimeout</td><td>10 s</td><td>10 s</td><td>10 s</td></tr>
 * </table>
 *
 * @param maxRetries retries after the first call
 * @param initialDelay delay before the first retry
 * @param backoffMultiplier growth factor of the delay per retry
 * @param maxDelay cap on the computed delay, before jitter
 * @param maxJitter upper bound of the random extra delay; zero disables jitter
 * @param failureThreshold consecutive failures that open a breaker
 * @param cooldown how long a breaker stays OPEN before a probe
 * @param queryTimeout how long a data-store query may run; zero disables the timeout
 */
public record RecoverySettings(
        int maxRetries,
        Duration initialDelay,
        double backoffMultiplier,
        Duration maxDelay,
        Duration maxJitter,
        int failureThreshold,
        Duration cooldown,
        Duration queryTimeout
) {

    public RecoverySettings {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        Objects.requireNonNull(maxJitter, "maxJitter must not be null");
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        Objects.requireNonNull(queryTimeout, "queryTimeout must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, was: " + backoffMultiplier);
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative() || maxJitter.isNegative()
                || cooldown.isNegative() || queryTimeout.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
    }

    public static RecoverySettings defaults() {
        return new RecoverySettings(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10),
                Duration.ofSeconds(1), 5, Duration.ofSeconds(60), Duration.ofSeconds(10));
    }

    /**
     * Settings for data-store queries and transactions.
     */
    public static RecoverySettings database() {
        return new RecoverySettings(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(5),
                Duration.ofSeconds(1), 5, Duration.ofSeconds(30), Duration.ofSeconds(10));
    }

    /**
     * Settings for calls to external services.
     */
    public static RecoverySettings outbound() {
        return new RecoverySettings(2, Duration.ofSeconds(1), 1.5, Duration.ofSeconds(3),
                Duration.ofSeconds(1), 10, Duration.ofSeconds(60), Duration.ofSeconds(10));
    }

    /**
     * Overrides fields of {@code base} from system properties or environment variables.
     *
     * <p>For prefix {@code resilience.db}, the retry budget is read from system property
     * {@code resilience.db.maxRetries} or, failing that, environment variable
     * {@code RESILIENCE_DB_MAX_RETRIES}. Durations are given in milliseconds.
     *
     * @throws IllegalStateException if a value is set but cannot be used
     */
    public static RecoverySettings fromEnvironment(String prefix, RecoverySettings base) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(base, "base must not be null");
        try {
            return new RecoverySettings(
                    read(prefix, "maxRetries", Integer::parseInt, base.maxRetries()),
                    read(prefix, "initialDelay", RecoverySettings::millis, base.initialDelay()),
                    read(prefix, "backoffMultiplier", Double::parseDouble, base.backoffMultiplier()),
                    read(prefix, "maxDelay", RecoverySettings::millis, base.maxDelay()),
                    read(prefix, "maxJitter", RecoverySettings::millis, base.maxJitter()),
                    read(prefix, "failureThreshold", Integer::parseInt, base.failureThreshold()),
                    read(prefix, "cooldown", RecoverySettings::millis, base.cooldown()),
                    read(prefix, "queryTimeout", RecoverySettings::millis, base.queryTimeout())
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid recovery settings for prefix '" + prefix + "': " + e.getMessage(), e);
        }
    }

    public RecoverySettings withMaxRetries(int maxRetries) {
        return new RecoverySettings(maxRetries, initialDelay, backoffMultiplier, maxDelay,
                maxJitter, failureThreshold, cooldown, queryTimeout);
    }

    public RecoverySettings withMaxJitter(Duration maxJitter) {
        return new RecoverySettings(maxRetries, initialDelay, backoffMultiplier, maxDelay,
                maxJitter, failureThreshold, cooldown, queryTimeout);
    }

    public RecoverySettings withQueryTimeout(Duration queryTimeout) {
        return new RecoverySettings(maxRetries, initialDelay, backoffMultiplier, maxDelay,
                maxJitter, failureThreshold, cooldown, queryTimeout);
    }

    public RecoverySettings withCircuitBreaker(int failureThreshold, Duration cooldown) {
        return new RecoverySettings(maxRetries, initialDelay, backoffMultiplier, maxDelay,
                maxJitter, failureThreshold, cooldown, queryTimeout);
    }

    public Backoff backoff() {
        return Backoff.exponential(initialDelay, backoffMultiplier, maxDelay).withJitter(maxJitter);
    }

    public RetryPolicy toRetryPolicy(String id) {
        return RetryPolicy.of(id, maxRetries, backoff());
    }

    public CircuitBreakerConfig toCircuitBreakerConfig() {
        return CircuitBreakerConfig.of(failureThreshold, cooldown);
    }

    private static <V> V read(String prefix, String field, Function<String, V> parser, V fallback) {
        String property = prefix + "." + field;
        String raw = OpReporterUtils.resolveOptionalConfig(property, OpReporterUtils.envVarFor(property));
        if (raw == null) {
            return fallback;
        }
        try {
            return parser.apply(raw);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("cannot parse " + property + "='" + raw + "'", e);
        }
    }

    private static Duration millis(String raw) {
        return Duration.ofMillis(Long.parseLong(raw));
    }
}
