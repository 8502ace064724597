package io.ringlookup.config.impl;

import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable config holder loaded from lookup.yaml
 */
@Getter
public final class LookupConfig {

    public static final int DEFAULT_MAX_RETRIES = 20;
    public static final long DEFAULT_RETRY_BACKOFF_MILLIS = 500L;
    public static final int DEFAULT_MAX_REDIRECTS = 20;
    public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000;

    private URI serviceUrl;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Duration retryBackoff = Duration.ofMillis(DEFAULT_RETRY_BACKOFF_MILLIS);
    private int maxRedirects = DEFAULT_MAX_REDIRECTS;
    private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;

    private LookupConfig() {
    }

    public static LookupConfig defaults(final URI serviceUrl) {
        final LookupConfig cfg = new LookupConfig();
        cfg.serviceUrl = serviceUrl;
        return cfg;
    }

    public static LookupConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null || m.get("serviceUrl") == null) {
                throw new IOException("serviceUrl is required in " + path);
            }

            final LookupConfig cfg = new LookupConfig();
            try {
                cfg.serviceUrl = new URI(String.valueOf(m.get("serviceUrl")));
            } catch (final URISyntaxException e) {
                throw new IOException("invalid serviceUrl in " + path + ": " + e.getMessage(), e);
            }
            cfg.maxRetries = (Integer) m.getOrDefault("maxRetries", DEFAULT_MAX_RETRIES);
            cfg.retryBackoff = Duration.ofMillis(
                    ((Number) m.getOrDefault("retryBackoffMillis", DEFAULT_RETRY_BACKOFF_MILLIS)).longValue());
            cfg.maxRedirects = (Integer) m.getOrDefault("maxRedirects", DEFAULT_MAX_REDIRECTS);
            cfg.connectTimeoutMillis = (Integer) m.getOrDefault("connectTimeoutMillis", DEFAULT_CONNECT_TIMEOUT_MILLIS);

            return cfg;
        }
    }

    public LookupConfig withMaxRetries(final int maxRetries) {
        final LookupConfig copy = copy();
        copy.maxRetries = maxRetries;
        return copy;
    }

    public LookupConfig withRetryBackoff(final Duration retryBackoff) {
        final LookupConfig copy = copy();
        copy.retryBackoff = retryBackoff;
        return copy;
    }

    public LookupConfig withMaxRedirects(final int maxRedirects) {
        final LookupConfig copy = copy();
        copy.maxRedirects = maxRedirects;
        return copy;
    }

    private LookupConfig copy() {
        final LookupConfig copy = new LookupConfig();
        copy.serviceUrl = serviceUrl;
        copy.maxRetries = maxRetries;
        copy.retryBackoff = retryBackoff;
        copy.maxRedirects = maxRedirects;
        copy.connectTimeoutMillis = connectTimeoutMillis;
        return copy;
    }
}
