package io.ringlookup.discovery;

import io.ringlookup.core.model.BrokerAddress;

import java.net.URI;

/**
 * What a single lookup response says about the topic's owner.
 *
 * @param brokerUrlTls null when the broker offered no TLS endpoint
 */
record LookupOutcome(URI brokerUrl,
                     URI brokerUrlTls,
                     boolean proxy,
                     boolean redirect,
                     boolean authoritative) {

    /** TLS endpoint when offered, plain endpoint otherwise. */
    URI serviceUrl() {
        return brokerUrlTls != null ? brokerUrlTls : brokerUrl;
    }

    /** Logical {@code host:port} of the owning broker, TLS first. */
    String brokerHostPort() {
        return brokerUrlTls != null
                ? BrokerAddress.hostPort(brokerUrlTls, BrokerAddress.DEFAULT_TLS_PORT)
                : BrokerAddress.hostPort(brokerUrl, BrokerAddress.DEFAULT_PORT);
    }
}
