package io.ringlookup.discovery.error;

/**
 * Base type for every way a topic lookup can fail.
 */
public abstract class ServiceDiscoveryException extends Exception {

    protected ServiceDiscoveryException(final String message) {
        super(message);
    }

    protected ServiceDiscoveryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
