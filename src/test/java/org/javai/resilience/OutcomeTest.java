package org.javai.resilience;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    @Test
    void ok_containsValueAndAttempts() {
        Outcome<String> outcome = Outcome.ok("hello", 2);

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(outcome.getOrThrow()).isEqualTo("hello");
        assertThat(outcome.getOrElse("default")).isEqualTo("hello");
    }

    @Test
    void ok_mapKeepsAttempts() {
        Outcome<Integer> mapped = Outcome.ok("hello", 3).map(String::length);

        assertThat(mapped.getOrThrow()).isEqualTo(5);
        assertThat(mapped.attempts()).isEqualTo(3);
    }

    @Test
    void fail_getOrThrow_throwsWithFailure() {
        Failure failure = createTestFailure("connection reset");
        Outcome<String> outcome = Outcome.fail(failure, 4);

        assertThat(outcome.isFail()).isTrue();
        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(OutcomeFailedException.class)
                .satisfies(e -> assertThat(((OutcomeFailedException) e).failure()).isEqualTo(failure));
    }

    @Test
    void fail_fallsBackToDefaults() {
        Outcome<String> outcome = Outcome.fail(createTestFailure("connection reset"), 1);

        assertThat(outcome.getOrElse("default")).isEqualTo("default");
        assertThat(outcome.getOrElseGet(() -> "computed")).isEqualTo("computed");
        assertThat(outcome.map(String::length).isFail()).isTrue();
    }

    @Test
    void negativeAttemptsAreRejected() {
        assertThatThrownBy(() -> Outcome.ok("x", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Failure createTestFailure(String message) {
        return Failure.transientFailure(FailureCode.of("transient", "ECONNRESET"), message, "db-query-1", null);
    }
}
