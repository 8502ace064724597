package io.ringlookup.schedule.impl;

import io.ringlookup.schedule.type.Delay;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link Delay} backed by a {@link ScheduledExecutorService}.
 */
public final class ScheduledDelay implements Delay, AutoCloseable {
    private final ScheduledExecutorService scheduler;
    private final boolean owned;

    public ScheduledDelay() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "ring-lookup-delay");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public ScheduledDelay(final ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private ScheduledDelay(final ScheduledExecutorService scheduler, final boolean owned) {
        this.scheduler = scheduler;
        this.owned = owned;
    }

    @Override
    public CompletableFuture<Void> delay(final Duration duration) {
        final CompletableFuture<Void> elapsed = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> elapsed.complete(null), duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (final RejectedExecutionException e) {
            elapsed.completeExceptionally(e);
        }
        return elapsed;
    }

    @Override
    public void close() {
        if (owned) scheduler.shutdownNow();
    }
}
