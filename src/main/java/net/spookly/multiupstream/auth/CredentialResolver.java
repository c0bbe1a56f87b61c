package net.spookly.multiupstream.auth;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import net.spookly.multiupstream.routing.UpstreamProxy;

/**
 * Resolves upstream credentials, preferring URL user-info over explicit fields.
 */
public final class CredentialResolver {
    private CredentialResolver() {
    }

    /**
     * Resolve credentials for an upstream, returning null when none are complete.
     */
    public static ProxyCredentials resolve(UpstreamProxy upstream) {
        if (upstream == null) {
            return null;
        }
        return resolve(upstream.url(), upstream.username(), upstream.password());
    }

    public static ProxyCredentials resolve(String url, String username, String password) {
        ProxyCredentials fromUrl = fromUrl(url);
        if (fromUrl != null && fromUrl.complete()) {
            return fromUrl;
        }
        ProxyCredentials explicit = new ProxyCredentials(username, password);
        if (explicit.complete()) {
            return explicit;
        }
        return null;
    }

    static ProxyCredentials fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String rawUserInfo;
        try {
            rawUserInfo = rawUserInfo(new URI(url.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
        if (rawUserInfo == null || rawUserInfo.isEmpty()) {
            return null;
        }
        int separator = rawUserInfo.indexOf(':');
        if (separator < 0) {
            return new ProxyCredentials(decode(rawUserInfo), null);
        }
        return new ProxyCredentials(
                decode(rawUserInfo.substring(0, separator)),
                decode(rawUserInfo.substring(separator + 1))
        );
    }

    /**
     * User-info of server-based and registry-based authorities alike.
     */
    static String rawUserInfo(URI uri) {
        if (uri.getRawUserInfo() != null) {
            return uri.getRawUserInfo();
        }
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        return at < 0 ? null : authority.substring(0, at);
    }

    private static String decode(String value) {
        // '+' is literal in user-info, unlike form encoding.
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
