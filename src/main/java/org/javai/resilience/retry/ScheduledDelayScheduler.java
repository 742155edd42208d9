package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link DelayScheduler} backed by a single daemon timer thread.
 *
 * <p>Completion of a delay only signals the waiting stage; continuations should not
 * do heavy work on the timer thread. Every pending delay is tracked so that
 * {@link #close()} can cancel them, leaving no live timers behind.
 */
public final class ScheduledDelayScheduler implements DelayScheduler, AutoCloseable {

    private static final AtomicInteger POOL_NUMBER = new AtomicInteger();

    private final ScheduledExecutorService executor;
    private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public ScheduledDelayScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(daemonThreads("resilience-timer-" + POOL_NUMBER.incrementAndGet())));
    }

    ScheduledDelayScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("scheduler is closed"));
        }

        CompletableFuture<Void> stage = new CompletableFuture<>();
        pending.add(stage);
        ScheduledFuture<?> timer = executor.schedule(() -> {
            stage.complete(null);
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        stage.whenComplete((ignored, error) -> {
            pending.remove(stage);
            timer.cancel(false);
        });
        return stage;
    }

    /**
     * Returns the number of delays that have neither fired nor been cancelled.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Cancels every pending delay and stops the timer thread.
     */
    @Override
    public void close() {
        closed = true;
        for (CompletableFuture<Void> stage : Set.copyOf(pending)) {
            stage.cancel(false);
        }
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
