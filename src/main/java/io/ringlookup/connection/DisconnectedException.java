package io.ringlookup.connection;

/**
 * The channel behind a connection is gone. Callers may reconnect and resend.
 */
public final class DisconnectedException extends ConnectionException {

    public DisconnectedException(final String message) {
        super(message);
    }
}
