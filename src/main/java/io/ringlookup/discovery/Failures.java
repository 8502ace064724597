package io.ringlookup.discovery;

import io.ringlookup.connection.ConnectionException;
import io.ringlookup.connection.DisconnectedException;
import io.ringlookup.discovery.error.LookupConnectionException;
import io.ringlookup.discovery.error.ServiceDiscoveryException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Maps failures reported by collaborators onto the lookup error types. */
final class Failures {

    private Failures() {
    }

    static Throwable unwrap(final Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    static boolean isDisconnect(final Throwable error) {
        return unwrap(error) instanceof DisconnectedException;
    }

    /** Transport errors become {@link LookupConnectionException}; lookup errors pass through. */
    static Throwable connection(final Throwable error) {
        final Throwable cause = unwrap(error);
        if (cause instanceof ServiceDiscoveryException) return cause;
        if (cause instanceof ConnectionException ce) return new LookupConnectionException(ce);
        return new LookupConnectionException(new ConnectionException(String.valueOf(cause.getMessage()), cause));
    }
}
