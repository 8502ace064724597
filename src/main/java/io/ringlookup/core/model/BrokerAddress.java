package io.ringlookup.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * Where to reach the broker that owns a topic.
 *
 * @param url       physical address to open a socket to; the service URL itself when traffic is proxied
 * @param brokerUrl logical {@code host:port} of the owning broker, sent to the peer in the connect handshake
 * @param proxy     whether traffic must be tunneled through the service URL's proxy
 */
public record BrokerAddress(URI url, String brokerUrl, boolean proxy) {

    public static final int DEFAULT_PORT = 6650;
    public static final int DEFAULT_TLS_PORT = 6651;

    public BrokerAddress {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(brokerUrl, "brokerUrl");
    }

    /** Address of the discovery endpoint the client was configured with. */
    public static BrokerAddress base(final URI serviceUrl) {
        return new BrokerAddress(serviceUrl, hostPort(serviceUrl, defaultPort(serviceUrl)), false);
    }

    /** Renders {@code host:port}, substituting {@code defaultPort} when the URL has none. */
    public static String hostPort(final URI url, final int defaultPort) {
        final int port = portOf(url);
        return hostOf(url) + ":" + (port == -1 ? defaultPort : port);
    }

    /**
     * Host of {@code url}, or null when it has none.
     * <p>
     * {@link URI} only fills in the host for RFC 2396 hostnames, so names like {@code my_broker}
     * come back as a bare authority and are split here.
     */
    public static String hostOf(final URI url) {
        if (url.getHost() != null) return url.getHost();

        final String hostPort = serverPart(url);
        if (hostPort == null) return null;
        if (hostPort.startsWith("[")) {
            final int close = hostPort.indexOf(']');
            return close == -1 ? null : hostPort.substring(0, close + 1);
        }

        final int colon = hostPort.lastIndexOf(':');
        final String host = colon == -1 ? hostPort : hostPort.substring(0, colon);
        if (host.isEmpty() || (colon != -1 && parsePort(hostPort.substring(colon + 1)) == -2)) return null;
        return host;
    }

    /** Port of {@code url}, or -1 when it has none. */
    public static int portOf(final URI url) {
        if (url.getHost() != null) return url.getPort();

        final String hostPort = serverPart(url);
        if (hostPort == null) return -1;
        final int colon = hostPort.lastIndexOf(':');
        if (colon == -1 || colon < hostPort.lastIndexOf(']')) return -1;
        final int port = parsePort(hostPort.substring(colon + 1));
        return port < 0 ? -1 : port;
    }

    public static int defaultPort(final URI url) {
        final String scheme = url.getScheme();
        return scheme != null && scheme.endsWith("+ssl") ? DEFAULT_TLS_PORT : DEFAULT_PORT;
    }

    public String host() {
        return hostOf(url);
    }

    public int port() {
        final int port = portOf(url);
        return port == -1 ? defaultPort(url) : port;
    }

    private static String serverPart(final URI url) {
        final String authority = url.getAuthority();
        if (authority == null || authority.isEmpty()) return null;
        return authority.substring(authority.lastIndexOf('@') + 1);
    }

    // -1 for an empty port, -2 for one that is not a number in range
    private static int parsePort(final String port) {
        if (port.isEmpty()) return -1;
        try {
            final int p = Integer.parseInt(port);
            return p >= 0 && p <= 65535 ? p : -2;
        } catch (final NumberFormatException e) {
            return -2;
        }
    }
}
