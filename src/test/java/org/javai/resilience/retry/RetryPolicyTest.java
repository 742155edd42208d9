package org.javai.resilience.retry;

import org.javai.resilience.FailureType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void decide_retriesTransientUntilBudgetIsUsed() {
        RetryPolicy policy = RetryPolicy.fixed("p", 2, Duration.ofMillis(20));

        assertThat(policy.decide(1, FailureType.TRANSIENT))
                .isEqualTo(RetryDecision.Retry.after(Duration.ofMillis(20)));
        assertThat(policy.decide(2, FailureType.TRANSIENT)).isInstanceOf(RetryDecision.Retry.class);
        assertThat(policy.decide(3, FailureType.TRANSIENT)).isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void decide_neverRetriesTerminal() {
        RetryPolicy policy = RetryPolicy.fixed("p", 5, Duration.ZERO);

        assertThat(policy.decide(1, FailureType.TERMINAL)).isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void noRetry_givesUpAfterFirstAttempt() {
        assertThat(RetryPolicy.noRetry().decide(1, FailureType.TRANSIENT)).isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void rejectsNegativeBudget() {
        assertThatThrownBy(() -> RetryPolicy.fixed("p", -1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copies_keepOtherFields() {
        RetryPolicy policy = RetryPolicy.exponentialBackoff("p", 3, Duration.ofMillis(10), Duration.ofSeconds(1));
        RetryPolicy copy = policy.withMaxRetries(0);

        assertThat(copy.id()).isEqualTo("p");
        assertThat(copy.maxRetries()).isZero();
        assertThat(copy.backoff()).isSameAs(policy.backoff());
        assertThat(copy.classifierOverride()).isEmpty();
    }
}
