package org.javai.resilience.retry;

import org.javai.resilience.fixtures.ManualScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class DelaySchedulerTest {

    private final ManualScheduler scheduler = ManualScheduler.manual();

    @Test
    void within_cancellingTheResultCancelsTheTimer() {
        CompletableFuture<String> raced = scheduler.within(new CompletableFuture<String>(), Duration.ofSeconds(30),
                () -> new TimeoutException("slow"));
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        raced.cancel(false);

        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void within_workCompletionCancelsTheTimer() {
        CompletableFuture<String> work = new CompletableFuture<>();
        CompletableFuture<String> raced = scheduler.within(work, Duration.ofSeconds(30),
                () -> new TimeoutException("slow"));

        work.complete("done");

        assertThat(raced.join()).isEqualTo("done");
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void within_firedTimerFailsTheResult() {
        CompletableFuture<String> raced = scheduler.within(new CompletableFuture<String>(), Duration.ofSeconds(30),
                () -> new TimeoutException("slow"));

        scheduler.fireNext();

        assertThatThrownBy(raced::join).hasCauseInstanceOf(TimeoutException.class);
    }

    @Test
    void within_zeroTimeoutNeverSchedulesATimer() {
        CompletableFuture<String> raced = scheduler.within(new CompletableFuture<String>(), Duration.ZERO,
                () -> new TimeoutException("slow"));

        assertThat(scheduler.requested()).isEmpty();
        assertThat(raced).isNotDone();
    }
}
