package io.ringlookup.discovery.error;

import io.ringlookup.connection.ConnectionException;

/**
 * Acquiring or using a connection failed; the transport error is the cause.
 */
public final class LookupConnectionException extends ServiceDiscoveryException {

    public LookupConnectionException(final ConnectionException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized ConnectionException getCause() {
        return (ConnectionException) super.getCause();
    }
}
