package io.ringlookup.connection;

import java.io.IOException;

/**
 * Transport-level failure while acquiring or using a broker connection.
 */
public class ConnectionException extends IOException {

    public ConnectionException(final String message) {
        super(message);
    }

    public ConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
