package org.javai.resilience;

import org.javai.resilience.circuit.CircuitBreakerConfig;
import org.javai.resilience.retry.RetryListener;
import org.javai.resilience.retry.RetryPolicy;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-call options for {@link ErrorRecovery}. Anything left unset falls back to the
 * {@link RecoverySettings} of the {@code ErrorRecovery} instance.
 *
 * @param retryPolicy retry budget, backoff and classifier (may be null)
 * @param circuitBreaker breaker thresholds, used when the breaker is first created (may be null)
 * @param fallback value served instead of failing (may be null)
 * @param fallbackOnExhaustion also serve the fallback after retries are exhausted, not only when the breaker rejects
 * @param listener call-site retry hooks
 * @param <T> The type of value produced
 */
public record RecoveryOptions<T>(
        RetryPolicy retryPolicy,
        CircuitBreakerConfig circuitBreaker,
        Fallback<T> fallback,
        boolean fallbackOnExhaustion,
        RetryListener listener
) {

    public RecoveryOptions {
        listener = listener == null ? RetryListener.noOp() : listener;
    }

    public static <T> RecoveryOptions<T> defaults() {
        return new RecoveryOptions<>(null, null, null, false, null);
    }

    /**
     * Options that serve {@code value} while the breaker rejects calls.
     */
    public static <T> RecoveryOptions<T> withFallback(T value) {
        return new RecoveryOptions<>(null, null, Fallback.of(value), false, null);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public Optional<RetryPolicy> retryPolicyOverride() {
        return Optional.ofNullable(retryPolicy);
    }

    public Optional<CircuitBreakerConfig> circuitBreakerOverride() {
        return Optional.ofNullable(circuitBreaker);
    }

    public Optional<Fallback<T>> fallbackIfAny() {
        return Optional.ofNullable(fallback);
    }

    public Builder<T> toBuilder() {
        return new Builder<T>()
                .retryPolicy(retryPolicy)
                .circuitBreaker(circuitBreaker)
                .fallback(fallback)
                .fallbackOnExhaustion(fallbackOnExhaustion)
                .listener(listener);
    }

    public static final class Builder<T> {
        private RetryPolicy retryPolicy;
        private CircuitBreakerConfig circuitBreaker;
        private Fallback<T> fallback;
        private boolean fallbackOnExhaustion;
        private RetryListener listener = RetryListener.noOp();

        private Builder() {}

        public Builder<T> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder<T> circuitBreaker(CircuitBreakerConfig circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder<T> fallback(Fallback<T> fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder<T> fallbackValue(T value) {
            this.fallback = Fallback.of(value);
            return this;
        }

        public Builder<T> fallbackOnExhaustion(boolean fallbackOnExhaustion) {
            this.fallbackOnExhaustion = fallbackOnExhaustion;
            return this;
        }

        public Builder<T> listener(RetryListener listener) {
            this.listener = Objects.requireNonNullElse(listener, RetryListener.noOp());
            return this;
        }

        public RecoveryOptions<T> build() {
            return new RecoveryOptions<>(retryPolicy, circuitBreaker, fallback, fallbackOnExhaustion, listener);
        }
    }
}
