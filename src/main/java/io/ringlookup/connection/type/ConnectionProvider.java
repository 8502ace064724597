package io.ringlookup.connection.type;

import io.ringlookup.core.model.BrokerAddress;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Hands out connections to the cluster. Implementations must tolerate concurrent callers.
 */
public interface ConnectionProvider {

    /** Connection to the discovery endpoint ({@link #baseAddress()}). */
    default CompletableFuture<BrokerConnection> baseConnection() {
        return connection(baseAddress());
    }

    /** Returns a live connection to {@code address}, opening one if needed. */
    CompletableFuture<BrokerConnection> connection(BrokerAddress address);

    BrokerAddress baseAddress();

    /** The service URL the client was configured with. */
    URI serviceUrl();
}
