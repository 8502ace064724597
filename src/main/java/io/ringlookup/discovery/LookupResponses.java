package io.ringlookup.discovery;

import io.ringlookup.api.LookupApi;
import io.ringlookup.core.model.BrokerAddress;
import io.ringlookup.discovery.error.TopicNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Extracts a {@link LookupOutcome} from a lookup response.
 */
@Slf4j
final class LookupResponses {

    private LookupResponses() {
    }

    static LookupOutcome parse(final LookupApi.CommandLookupTopicResponse response) throws TopicNotFoundException {
        final boolean proxy = response.getProxyThroughServiceUrl();
        final boolean authoritative = response.getAuthoritative();
        final boolean redirect = response.hasResponse()
                && response.getResponse() == LookupApi.CommandLookupTopicResponse.LookupType.Redirect;

        if (!response.hasBrokerServiceUrl()) {
            throw new TopicNotFoundException("lookup response carries no broker service URL");
        }

        final URI brokerUrl = parseUrl(response.getBrokerServiceUrl());
        final URI brokerUrlTls = response.hasBrokerServiceUrlTls()
                ? parseUrl(response.getBrokerServiceUrlTls())
                : null;

        return new LookupOutcome(brokerUrl, brokerUrlTls, proxy, redirect, authoritative);
    }

    private static URI parseUrl(final String url) throws TopicNotFoundException {
        final URI parsed;
        try {
            parsed = new URI(url);
        } catch (final URISyntaxException e) {
            log.error("error parsing URL {}: {}", url, e.getMessage());
            throw new TopicNotFoundException("invalid broker URL: " + url, e);
        }
        if (BrokerAddress.hostOf(parsed) == null) {
            log.error("error parsing URL {}: no host", url);
            throw new TopicNotFoundException("broker URL has no host: " + url);
        }
        return parsed;
    }
}
