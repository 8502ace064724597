package io.ringlookup.discovery;

import io.ringlookup.config.impl.LookupConfig;
import io.ringlookup.connection.type.ConnectionProvider;
import io.ringlookup.core.model.BrokerAddress;
import io.ringlookup.schedule.type.Delay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Looks up broker addresses for topics and partitioned topics.
 * <p>
 * Single entry point for finding out where a topic lives: follows redirects issued by the
 * cluster, routes through the proxy when told to, and retries while brokers report
 * {@code ServiceNotReady}. Results are never cached; every call queries the cluster again.
 * <p>
 * Futures fail with a {@link io.ringlookup.discovery.error.ServiceDiscoveryException} subtype:
 * {@link io.ringlookup.discovery.error.LookupConnectionException} for transport trouble,
 * {@link io.ringlookup.discovery.error.LookupQueryException} when the cluster refused to answer,
 * {@link io.ringlookup.discovery.error.TopicNotFoundException} when the answer had no usable URL.
 */
@Slf4j
@RequiredArgsConstructor
public final class ServiceDiscovery {
    private final ConnectionProvider connections;
    private final Delay delay;
    private final LookupConfig config;

    /** Resolves the broker that currently owns {@code topic}. */
    public CompletableFuture<BrokerAddress> lookupTopic(final String topic) {
        return new TopicLookup(topic, connections, delay, config).start();
    }

    /** Number of partitions of a partitioned topic. */
    public CompletableFuture<Integer> lookupPartitionedTopicNumber(final String topic) {
        return new PartitionCountLookup(topic, connections, delay, config).start();
    }

    /**
     * Resolves every partition of {@code topic} concurrently.
     * <p>
     * Completes with one {@code (partition topic name, address)} entry per partition, in partition
     * order, or fails with the first failure observed. Lookups still in flight at that point keep
     * running; their results are dropped.
     */
    public CompletableFuture<List<Map.Entry<String, BrokerAddress>>> lookupPartitionedTopic(final String topic) {
        return lookupPartitionedTopicNumber(topic).thenCompose(partitions -> {
            log.debug("topic {} has {} partitions", topic, partitions);

            final List<CompletableFuture<Map.Entry<String, BrokerAddress>>> lookups = new ArrayList<>(partitions);
            for (int i = 0; i < partitions; i++) {
                final String name = TopicName.partition(topic, i);
                lookups.add(lookupTopic(name).thenApply(address -> Map.entry(name, address)));
            }
            return allOrFirstFailure(lookups);
        });
    }

    private static <T> CompletableFuture<List<T>> allOrFirstFailure(final List<CompletableFuture<T>> futures) {
        final CompletableFuture<List<T>> all = new CompletableFuture<>();

        for (final CompletableFuture<T> f : futures) {
            f.whenComplete((v, ex) -> {
                if (ex != null) all.completeExceptionally(Failures.unwrap(ex));
            });
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).whenComplete((v, ex) -> {
            if (ex != null) return; // reported by the per-lookup listeners

            final List<T> results = new ArrayList<>(futures.size());
            for (final CompletableFuture<T> f : futures) {
                results.add(f.join());
            }
            all.complete(results);
        });

        return all;
    }
}
