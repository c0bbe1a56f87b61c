package net.spookly.multiupstream.routing;

import java.util.Locale;

/**
 * Supported upstream proxy schemes and their default ports.
 */
public enum UpstreamScheme {
    HTTP("http", 80, false),
    HTTPS("https", 443, false),
    SOCKS5("socks5", 1080, true);

    private final String scheme;
    private final int defaultPort;
    private final boolean tunnel;

    UpstreamScheme(String scheme, int defaultPort, boolean tunnel) {
        this.scheme = scheme;
        this.defaultPort = defaultPort;
        this.tunnel = tunnel;
    }

    public String scheme() {
        return scheme;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Whether credentials travel inside a tunnel handshake instead of a Proxy-Authorization header.
     */
    public boolean tunnel() {
        return tunnel;
    }

    public static UpstreamScheme fromUrlScheme(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (UpstreamScheme candidate : values()) {
            if (candidate.scheme.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
