package io.ringlookup.connection.type;

import io.ringlookup.api.LookupApi;

import java.util.concurrent.CompletableFuture;

/**
 * A live session with one broker (or with a proxy in front of it).
 * <p>
 * Returned futures complete exceptionally with a
 * {@link io.ringlookup.connection.ConnectionException}; a dropped channel is reported as
 * {@link io.ringlookup.connection.DisconnectedException}.
 */
public interface BrokerConnection extends AutoCloseable {

    CompletableFuture<LookupApi.CommandLookupTopicResponse> sendLookupTopic(String topic, boolean authoritative);

    CompletableFuture<LookupApi.CommandPartitionedTopicMetadataResponse> sendPartitionedTopicMetadata(String topic);

    boolean isClosed();

    @Override
    default void close() {
        // no-op
    }
}
