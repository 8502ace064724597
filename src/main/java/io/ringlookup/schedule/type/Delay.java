package io.ringlookup.schedule.type;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Timer capability: the returned future completes once {@code duration} has elapsed.
 * Must not block the calling thread.
 */
@FunctionalInterface
public interface Delay {
    CompletableFuture<Void> delay(Duration duration);
}
