package net.spookly.multiupstream.routing;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Parses upstream proxy URLs into addresses, applying scheme default ports.
 */
public final class UpstreamAddressResolver {
    private UpstreamAddressResolver() {
    }

    /**
     * Resolve a proxy URL, returning null when the scheme or host is missing or unsupported.
     */
    public static UpstreamAddress resolve(String url) {
        URI uri = parse(url);
        if (uri == null) {
            return null;
        }
        UpstreamScheme scheme = UpstreamScheme.fromUrlScheme(uri.getScheme());
        if (scheme == null) {
            return null;
        }
        String host = uri.getHost();
        int port = uri.getPort();
        if (host == null) {
            // Registry-based authority, e.g. a hostname with underscores.
            return fromAuthority(scheme, uri.getRawAuthority());
        }
        if (host.isEmpty()) {
            return null;
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        return new UpstreamAddress(scheme, host, port > 0 ? port : scheme.defaultPort());
    }

    /**
     * Split a raw {@code [user-info@]host[:port]} authority that {@link URI} did not parse as a server.
     */
    static UpstreamAddress fromAuthority(UpstreamScheme scheme, String authority) {
        if (authority == null || authority.isEmpty()) {
            return null;
        }
        String hostPort = authority.substring(authority.lastIndexOf('@') + 1);
        if (hostPort.startsWith("[")) {
            return null;
        }
        String host = hostPort;
        int port = scheme.defaultPort();
        int lastColon = hostPort.lastIndexOf(':');
        if (lastColon >= 0) {
            host = hostPort.substring(0, lastColon);
            String portRaw = hostPort.substring(lastColon + 1);
            if (!portRaw.isEmpty()) {
                try {
                    port = Integer.parseInt(portRaw);
                } catch (NumberFormatException e) {
                    return null;
                }
                if (port < 1 || port > 65535) {
                    return null;
                }
            }
        }
        if (host.isEmpty() || host.indexOf(':') >= 0) {
            return null;
        }
        return new UpstreamAddress(scheme, host, port);
    }

    /**
     * Parse a proxy URL, returning null when it is blank or not a valid URI.
     */
    static URI parse(String url) {
        if (url == null || url.trim().isEmpty()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
