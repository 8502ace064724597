package io.ringlookup.discovery;

import io.ringlookup.api.LookupApi;
import io.ringlookup.config.impl.LookupConfig;
import io.ringlookup.connection.type.BrokerConnection;
import io.ringlookup.connection.type.ConnectionProvider;
import io.ringlookup.discovery.error.LookupQueryException;
import io.ringlookup.schedule.type.Delay;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the discovery endpoint how many partitions a topic has. Same retry rules as
 * {@link TopicLookup}, without redirects.
 */
@Slf4j
final class PartitionCountLookup {
    private final String topic;
    private final ConnectionProvider connections;
    private final Delay delay;
    private final LookupConfig config;
    private final CompletableFuture<Integer> result = new CompletableFuture<>();

    private BrokerConnection connection;
    private int retriesLeft;

    PartitionCountLookup(final String topic,
                         final ConnectionProvider connections,
                         final Delay delay,
                         final LookupConfig config) {
        this.topic = topic;
        this.connections = connections;
        this.delay = delay;
        this.config = config;
        this.retriesLeft = config.getMaxRetries();
    }

    CompletableFuture<Integer> start() {
        connections.baseConnection().whenComplete((conn, ex) -> {
            if (ex != null) {
                result.completeExceptionally(Failures.connection(ex));
                return;
            }
            connection = conn;
            query();
        });
        return result;
    }

    private void query() {
        connection.sendPartitionedTopicMetadata(topic).whenComplete((response, ex) -> {
            if (ex == null) {
                onResponse(response);
                return;
            }
            if (!Failures.isDisconnect(ex)) {
                result.completeExceptionally(Failures.connection(ex));
                return;
            }

            log.error("tried to lookup partitions of {} but connection was closed, reconnecting...", topic);
            connections.baseConnection()
                    .thenCompose(conn -> {
                        connection = conn;
                        return conn.sendPartitionedTopicMetadata(topic);
                    })
                    .whenComplete((resent, resendEx) -> {
                        if (resendEx != null) {
                            result.completeExceptionally(Failures.connection(resendEx));
                        } else {
                            onResponse(resent);
                        }
                    });
        });
    }

    private void onResponse(final LookupApi.CommandPartitionedTopicMetadataResponse response) {
        final LookupApi.ServerError error = response.hasError() ? response.getError() : null;
        final String message = response.hasMessage() ? response.getMessage() : null;

        if (!response.hasResponse()
                || response.getResponse() == LookupApi.CommandPartitionedTopicMetadataResponse.LookupType.Failed) {
            if (error == LookupApi.ServerError.ServiceNotReady && retriesLeft > 0) {
                log.error("lookup_partitioned_topic_number({}) answered ServiceNotReady, retrying request after {}ms (max_retries = {})",
                        topic, config.getRetryBackoff().toMillis(), retriesLeft);
                retriesLeft--;
                delay.delay(config.getRetryBackoff()).whenComplete((v, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(Failures.unwrap(ex));
                    } else {
                        query();
                    }
                });
                return;
            }
            result.completeExceptionally(new LookupQueryException(error, message));
            return;
        }

        if (!response.hasPartitions()) {
            result.completeExceptionally(new LookupQueryException(error, message));
            return;
        }

        // uint32 on the wire
        final long partitions = Integer.toUnsignedLong(response.getPartitions());
        if (partitions > Integer.MAX_VALUE) {
            result.completeExceptionally(new LookupQueryException(error,
                    "partition count " + partitions + " of " + topic + " is out of range"));
            return;
        }
        result.complete((int) partitions);
    }
}
