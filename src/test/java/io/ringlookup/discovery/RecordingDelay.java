package io.ringlookup.discovery;

import io.ringlookup.schedule.type.Delay;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Completes every delay immediately and remembers what was asked for. */
final class RecordingDelay implements Delay {
    private final List<Duration> delays = Collections.synchronizedList(new ArrayList<>());

    @Override
    public CompletableFuture<Void> delay(final Duration duration) {
        delays.add(duration);
        return CompletableFuture.completedFuture(null);
    }

    List<Duration> delays() {
        synchronized (delays) {
            return List.copyOf(delays);
        }
    }
}
