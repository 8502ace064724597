package io.ringlookup.discovery.error;

import io.ringlookup.api.LookupApi.ServerError;

import java.util.Optional;

/**
 * The cluster rejected the query, or could not answer it within the retry budget.
 */
public final class LookupQueryException extends ServiceDiscoveryException {
    private final ServerError serverError;
    private final String serverMessage;

    public LookupQueryException(final ServerError serverError, final String serverMessage) {
        super("lookup query failed: " + (serverError == null ? "no server error" : serverError.name())
                + (serverMessage == null ? "" : " (" + serverMessage + ")"));
        this.serverError = serverError;
        this.serverMessage = serverMessage;
    }

    public Optional<ServerError> serverError() {
        return Optional.ofNullable(serverError);
    }

    public Optional<String> serverMessage() {
        return Optional.ofNullable(serverMessage);
    }
}
