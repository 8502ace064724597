package io.ringlookup.config.type;

import io.ringlookup.config.impl.LookupConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads lookup configuration from a YAML file by delegating to {@link LookupConfig#load(String)}.
     * <p>
     * Expected structure:
     * <pre>
     * serviceUrl: ring://localhost:6650
     * maxRetries: 20
     * retryBackoffMillis: 500
     * maxRedirects: 20
     * connectTimeoutMillis: 10000
     * </pre>
     * Only {@code serviceUrl} is mandatory.
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link LookupConfig} instance
     * @throws IOException if the file cannot be read, parsed, or lacks a service URL
     */
    public static LookupConfig load(final String path) throws IOException {
        return LookupConfig.load(path);
    }
}
