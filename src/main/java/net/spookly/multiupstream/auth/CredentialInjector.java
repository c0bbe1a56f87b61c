package net.spookly.multiupstream.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import net.spookly.multiupstream.routing.UpstreamAddress;
import net.spookly.multiupstream.routing.UpstreamProxy;

/**
 * Attaches Proxy-Authorization headers for header-authenticated upstreams.
 * <p>
 * Tunnel upstreams authenticate inside their handshake and never receive a header.
 */
public final class CredentialInjector {
    private static final String BASIC_PREFIX = "Basic ";

    private CredentialInjector() {
    }

    /**
     * Add the Basic Proxy-Authorization header when the upstream uses header auth and has credentials.
     *
     * @return true when a header was set
     */
    public static boolean inject(UpstreamProxy upstream, UpstreamAddress address, HttpHeaders headers) {
        if (upstream == null || address == null || headers == null || address.scheme().tunnel()) {
            return false;
        }
        ProxyCredentials credentials = CredentialResolver.resolve(upstream);
        if (credentials == null) {
            return false;
        }
        headers.set(HttpHeaderNames.PROXY_AUTHORIZATION, basicAuthorization(credentials));
        return true;
    }

    /**
     * Build a {@code Basic} authorization value from {@code username:password}.
     */
    public static String basicAuthorization(ProxyCredentials credentials) {
        String raw = credentials.username() + ":" + credentials.password();
        return BASIC_PREFIX + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
