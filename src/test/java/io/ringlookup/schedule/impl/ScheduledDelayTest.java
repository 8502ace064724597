package io.ringlookup.schedule.impl;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ScheduledDelayTest {

    @Test
    void completesAfterTheRequestedDuration() throws Exception {
        try (final ScheduledDelay delay = new ScheduledDelay()) {
            final long start = System.nanoTime();
            final CompletableFuture<Void> elapsed = delay.delay(Duration.ofMillis(200));

            assertFalse(elapsed.isDone());
            elapsed.get(5, TimeUnit.SECONDS);
            assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(200));
        }
    }

    @Test
    void failsOnceClosed() {
        final ScheduledDelay delay = new ScheduledDelay();
        delay.close();

        final ExecutionException ex = assertThrows(ExecutionException.class,
                () -> delay.delay(Duration.ofMillis(1)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, ex.getCause());
    }
}
