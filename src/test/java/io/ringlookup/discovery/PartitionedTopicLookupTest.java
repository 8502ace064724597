package io.ringlookup.discovery;

import io.ringlookup.api.LookupApi;
import io.ringlookup.config.impl.LookupConfig;
import io.ringlookup.connection.DisconnectedException;
import io.ringlookup.core.model.BrokerAddress;
import io.ringlookup.discovery.error.LookupQueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static io.ringlookup.discovery.Responses.connect;
import static io.ringlookup.discovery.Responses.failed;
import static io.ringlookup.discovery.Responses.metadataFailed;
import static io.ringlookup.discovery.Responses.partitions;
import static io.ringlookup.discovery.ServiceDiscoveryTest.failure;
import static io.ringlookup.discovery.ServiceDiscoveryTest.get;
import static org.junit.jupiter.api.Assertions.*;

final class PartitionedTopicLookupTest {

    private FakeConnectionProvider provider;
    private RecordingDelay delay;
    private ServiceDiscovery discovery;

    @BeforeEach
    void setUp() {
        provider = new FakeConnectionProvider();
        delay = new RecordingDelay();
        discovery = new ServiceDiscovery(provider, delay, LookupConfig.defaults(FakeConnectionProvider.SERVICE_URL));
    }

    @Test
    void partitionCountIsReturned() throws Exception {
        provider.registerBase(new ScriptedConnection("base").onPartitionedMetadata(partitions(8)));

        assertEquals(8, get(discovery.lookupPartitionedTopicNumber("events")));
    }

    @Test
    void partitionCountRetriesWhileServiceNotReady() throws Exception {
        final ScriptedConnection base = new ScriptedConnection("base").onPartitionedMetadata(
                metadataFailed(LookupApi.ServerError.ServiceNotReady, "starting"),
                metadataFailed(LookupApi.ServerError.ServiceNotReady, "starting"),
                partitions(4));
        provider.registerBase(base);

        assertEquals(4, get(discovery.lookupPartitionedTopicNumber("events")));
        assertEquals(2, delay.delays().size());
        assertEquals(3, base.metadataQueries().size());
    }

    @Test
    void partitionCountGivesUpAfterRetryBudget() {
        final ScriptedConnection base = new ScriptedConnection("base");
        for (int i = 0; i < 21; i++) {
            base.onPartitionedMetadata(metadataFailed(LookupApi.ServerError.ServiceNotReady, "starting"));
        }
        provider.registerBase(base);

        final LookupQueryException ex = failure(discovery.lookupPartitionedTopicNumber("events"), LookupQueryException.class);

        assertEquals(LookupApi.ServerError.ServiceNotReady, ex.serverError().orElseThrow());
        assertEquals(20, delay.delays().size());
    }

    @Test
    void successWithoutPartitionCountIsAQueryFailure() {
        provider.registerBase(new ScriptedConnection("base").onPartitionedMetadata(
                LookupApi.CommandPartitionedTopicMetadataResponse.newBuilder()
                        .setResponse(LookupApi.CommandPartitionedTopicMetadataResponse.LookupType.Success)
                        .setMessage("no metadata")
                        .build()));

        final LookupQueryException ex = failure(discovery.lookupPartitionedTopicNumber("events"), LookupQueryException.class);

        assertTrue(ex.serverError().isEmpty());
        assertEquals("no metadata", ex.serverMessage().orElseThrow());
    }

    @Test
    void partitionCountBeyondIntRangeIsAQueryFailure() {
        // 0xFFFFFFFF as uint32
        provider.registerBase(new ScriptedConnection("base").onPartitionedMetadata(partitions(-1), partitions(-1)));

        final LookupQueryException count = failure(discovery.lookupPartitionedTopicNumber("events"), LookupQueryException.class);
        assertTrue(count.serverMessage().orElseThrow().contains("4294967295"), count.getMessage());

        failure(discovery.lookupPartitionedTopic("events"), LookupQueryException.class);
    }

    @Test
    void largestIntPartitionCountIsAccepted() throws Exception {
        provider.registerBase(new ScriptedConnection("base").onPartitionedMetadata(partitions(Integer.MAX_VALUE)));

        assertEquals(Integer.MAX_VALUE, get(discovery.lookupPartitionedTopicNumber("events")));
    }

    @Test
    void partitionCountReconnectsToBaseOnDisconnect() throws Exception {
        final ScriptedConnection stale = new ScriptedConnection("stale")
                .onPartitionedMetadata(new DisconnectedException("gone"));
        final ScriptedConnection fresh = new ScriptedConnection("fresh").onPartitionedMetadata(partitions(2));
        provider.registerBase(stale, fresh);

        assertEquals(2, get(discovery.lookupPartitionedTopicNumber("events")));
        assertEquals(List.of("events"), fresh.metadataQueries());
    }

    @Test
    void resolvesEveryPartitionInIndexOrder() throws Exception {
        final ScriptedConnection base = new ScriptedConnection("base")
                .onPartitionedMetadata(partitions(3))
                .onLookup("t-partition-0", connect("ring://b0:6650").build())
                .onLookup("t-partition-1", connect("ring://b1:6650").build())
                .onLookup("t-partition-2", connect("ring://b2:6650").build());
        provider.registerBase(base);
        for (int i = 0; i < 3; i++) {
            provider.register(URI.create("ring://b" + i + ":6650"), new ScriptedConnection("b" + i));
        }

        final List<Map.Entry<String, BrokerAddress>> result = get(discovery.lookupPartitionedTopic("t"));

        assertEquals(List.of("t-partition-0", "t-partition-1", "t-partition-2"),
                result.stream().map(Map.Entry::getKey).toList());
        for (int i = 0; i < 3; i++) {
            assertEquals("b" + i + ":6650", result.get(i).getValue().brokerUrl());
        }
    }

    @Test
    void partitionLookupsRunConcurrently() throws Exception {
        final ScriptedConnection base = new ScriptedConnection("base")
                .onPartitionedMetadata(partitions(3))
                .onLookup("t-partition-0", connect("ring://b0:6650").build())
                .onLookup("t-partition-1", connect("ring://b1:6650").build())
                .onLookup("t-partition-2", connect("ring://b2:6650").build())
                .hold();
        provider.registerBase(base);
        for (int i = 0; i < 3; i++) {
            provider.register(URI.create("ring://b" + i + ":6650"), new ScriptedConnection("b" + i));
        }

        final CompletableFuture<List<Map.Entry<String, BrokerAddress>>> result = discovery.lookupPartitionedTopic("t");

        assertEquals(3, base.lookups().size(), "all partitions queried before any answer");
        assertFalse(result.isDone());

        base.release("t-partition-2");
        base.release("t-partition-0");
        assertFalse(result.isDone());
        base.release("t-partition-1");

        assertEquals(List.of("t-partition-0", "t-partition-1", "t-partition-2"),
                get(result).stream().map(Map.Entry::getKey).toList());
    }

    @Test
    void oneFailedPartitionFailsTheWholeLookup() {
        final ScriptedConnection base = new ScriptedConnection("base")
                .onPartitionedMetadata(partitions(3))
                .onLookup("t-partition-0", connect("ring://b0:6650").build())
                .onLookup("t-partition-1", failed(LookupApi.ServerError.TopicNotFound, "gone"))
                .onLookup("t-partition-2", connect("ring://b2:6650").build());
        provider.registerBase(base)
                .register(URI.create("ring://b0:6650"), new ScriptedConnection("b0"))
                .register(URI.create("ring://b2:6650"), new ScriptedConnection("b2"));

        final LookupQueryException ex = failure(discovery.lookupPartitionedTopic("t"), LookupQueryException.class);

        assertEquals(LookupApi.ServerError.TopicNotFound, ex.serverError().orElseThrow());
    }

    @Test
    void firstFailureCompletesWithoutWaitingForSiblings() {
        final ScriptedConnection base = new ScriptedConnection("base")
                .onPartitionedMetadata(partitions(2))
                .onLookup("t-partition-0", connect("ring://b0:6650").build())
                .onLookup("t-partition-1", failed(LookupApi.ServerError.AuthorizationError, "denied"))
                .hold();
        provider.registerBase(base).register(URI.create("ring://b0:6650"), new ScriptedConnection("b0"));

        final CompletableFuture<List<Map.Entry<String, BrokerAddress>>> result = discovery.lookupPartitionedTopic("t");
        base.release("t-partition-1");

        assertTrue(result.isCompletedExceptionally(), "partition-0 is still pending");
        failure(result, LookupQueryException.class);
    }

    @Test
    void zeroPartitionsResolveToEmptyList() throws Exception {
        provider.registerBase(new ScriptedConnection("base").onPartitionedMetadata(partitions(0)));

        assertTrue(get(discovery.lookupPartitionedTopic("t")).isEmpty());
    }

    @Test
    void partitionNamesFollowTheSuffixConvention() {
        assertEquals("t-partition-7", TopicName.partition("t", 7));
        assertThrows(IllegalArgumentException.class, () -> TopicName.partition("t", -1));
    }
}
