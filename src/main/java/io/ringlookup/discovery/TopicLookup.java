package io.ringlookup.discovery;

import io.ringlookup.api.LookupApi;
import io.ringlookup.config.impl.LookupConfig;
import io.ringlookup.connection.type.BrokerConnection;
import io.ringlookup.connection.type.ConnectionProvider;
import io.ringlookup.core.model.BrokerAddress;
import io.ringlookup.discovery.error.LookupQueryException;
import io.ringlookup.discovery.error.TopicNotFoundException;
import io.ringlookup.schedule.type.Delay;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * One lookup chain for one topic: query, then retry, follow a redirect, or settle.
 * <p>
 * All fields are confined to the chain. Each step runs in the completion callback of the
 * previous one, so steps never overlap. The chain ends after at most
 * {@code maxRetries + maxRedirects + 1} queries.
 */
@Slf4j
final class TopicLookup {

    enum State { RETRY, REDIRECT, RESOLVED, FAILED }

    private final String topic;
    private final ConnectionProvider connections;
    private final Delay delay;
    private final LookupConfig config;
    private final URI serviceUrl;
    private final CompletableFuture<BrokerAddress> result = new CompletableFuture<>();

    private BrokerConnection connection;
    private BrokerAddress brokerAddress;
    private boolean authoritative;
    private boolean proxiedQuery;
    private int retriesLeft;
    private int redirectsLeft;
    private Throwable failure;

    TopicLookup(final String topic,
                final ConnectionProvider connections,
                final Delay delay,
                final LookupConfig config) {
        this.topic = topic;
        this.connections = connections;
        this.delay = delay;
        this.config = config;
        this.serviceUrl = connections.serviceUrl();
        this.brokerAddress = connections.baseAddress();
        this.retriesLeft = config.getMaxRetries();
        this.redirectsLeft = config.getMaxRedirects();
    }

    CompletableFuture<BrokerAddress> start() {
        connections.baseConnection().whenComplete((conn, ex) -> {
            if (ex != null) {
                result.completeExceptionally(Failures.connection(ex));
                return;
            }
            connection = conn;
            query();
        });
        return result;
    }

    private void query() {
        connection.sendLookupTopic(topic, authoritative).whenComplete((response, ex) -> {
            if (ex == null) {
                advance(onResponse(response));
                return;
            }
            if (!Failures.isDisconnect(ex)) {
                result.completeExceptionally(Failures.connection(ex));
                return;
            }

            log.error("tried to lookup topic {} but connection was closed, reconnecting...", topic);
            connections.connection(brokerAddress)
                    .thenCompose(conn -> {
                        connection = conn;
                        return conn.sendLookupTopic(topic, authoritative);
                    })
                    .whenComplete((resent, resendEx) -> {
                        if (resendEx != null) {
                            result.completeExceptionally(Failures.connection(resendEx));
                        } else {
                            advance(onResponse(resent));
                        }
                    });
        });
    }

    private State onResponse(final LookupApi.CommandLookupTopicResponse response) {
        if (!response.hasResponse()
                || response.getResponse() == LookupApi.CommandLookupTopicResponse.LookupType.Failed) {
            final LookupApi.ServerError error = response.hasError() ? response.getError() : null;
            if (error == LookupApi.ServerError.ServiceNotReady && retriesLeft > 0) {
                log.error("lookup({}) answered ServiceNotReady, retrying request after {}ms (max_retries = {})",
                        topic, config.getRetryBackoff().toMillis(), retriesLeft);
                retriesLeft--;
                return State.RETRY;
            }
            failure = new LookupQueryException(error, response.hasMessage() ? response.getMessage() : null);
            return State.FAILED;
        }

        final LookupOutcome outcome;
        try {
            outcome = LookupResponses.parse(response);
        } catch (final TopicNotFoundException e) {
            failure = e;
            return State.FAILED;
        }
        authoritative = outcome.authoritative();

        final boolean proxy = proxiedQuery || outcome.proxy();
        final URI url = proxy ? serviceUrl : outcome.serviceUrl();
        brokerAddress = new BrokerAddress(url, outcome.brokerHostPort(), proxy);
        proxiedQuery = proxy;

        if (!outcome.redirect()) {
            return State.RESOLVED;
        }
        if (redirectsLeft <= 0) {
            failure = new LookupQueryException(null,
                    "too many redirects (" + config.getMaxRedirects() + ") looking up " + topic);
            return State.FAILED;
        }
        redirectsLeft--;
        log.debug("lookup({}) redirected to {}", topic, brokerAddress);
        return State.REDIRECT;
    }

    private void advance(final State state) {
        switch (state) {
            case RETRY -> delay.delay(config.getRetryBackoff()).whenComplete((v, ex) -> {
                if (ex != null) {
                    result.completeExceptionally(Failures.unwrap(ex));
                } else {
                    query();
                }
            });

            case REDIRECT -> connections.connection(brokerAddress).whenComplete((conn, ex) -> {
                if (ex != null) {
                    result.completeExceptionally(Failures.connection(ex));
                    return;
                }
                connection = conn;
                query();
            });

            case RESOLVED -> {
                final BrokerAddress resolved = brokerAddress;
                connections.connection(resolved).whenComplete((conn, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(Failures.connection(ex));
                    } else {
                        result.complete(resolved);
                    }
                });
            }

            case FAILED -> result.completeExceptionally(failure);
        }
    }
}
