package io.ringlookup.discovery.error;

/**
 * A lookup response carried no usable broker URL.
 */
public final class TopicNotFoundException extends ServiceDiscoveryException {

    public TopicNotFoundException(final String message) {
        super(message);
    }

    public TopicNotFoundException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
