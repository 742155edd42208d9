package org.javai.resilience.fixtures;

import org.javai.resilience.retry.DelayScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Records every requested delay. In immediate mode delays complete at once;
 * otherwise they wait until the test fires them.
 */
public class ManualScheduler implements DelayScheduler {

    private final boolean immediate;
    private final List<Duration> requested = new ArrayList<>();
    private final List<CompletableFuture<Void>> pending = new ArrayList<>();

    private ManualScheduler(boolean immediate) {
        this.immediate = immediate;
    }

    public static ManualScheduler immediate() {
        return new ManualScheduler(true);
    }

    public static ManualScheduler manual() {
        return new ManualScheduler(false);
    }

    @Override
    public synchronized CompletableFuture<Void> delay(Duration delay) {
        requested.add(delay);
        if (immediate) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> stage = new CompletableFuture<>();
        pending.add(stage);
        return stage;
    }

    public synchronized List<Duration> requested() {
        return List.copyOf(requested);
    }

    /**
     * Delays that are neither fired nor cancelled.
     */
    public synchronized int pendingCount() {
        return (int) pending.stream().filter(stage -> !stage.isDone()).count();
    }

    public void fireNext() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = pending.stream().filter(stage -> !stage.isDone()).findFirst()
                    .orElseThrow(() -> new IllegalStateException("no pending delay"));
        }
        next.complete(null);
    }
}
