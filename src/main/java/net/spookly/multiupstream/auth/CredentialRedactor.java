package net.spookly.multiupstream.auth;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Redacts credentials for logs and printed configuration.
 */
public final class CredentialRedactor {
    private static final String REDACTED = "REDACTED";

    private CredentialRedactor() {
    }

    /**
     * Return a safe representation of a secret value.
     *
     * @param secret the raw value
     * @return {@code null} when the value is {@code null}, otherwise {@code REDACTED}
     */
    public static String redact(String secret) {
        if (secret == null) {
            return null;
        }
        if (secret.isEmpty()) {
            return "";
        }
        return REDACTED;
    }

    /**
     * Replace the user-info part of a proxy URL, keeping scheme, host and port readable.
     */
    public static String redactUrl(String url) {
        if (url == null || url.isEmpty()) {
            return url;
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return url.indexOf('@') >= 0 ? REDACTED : url;
        }
        if (CredentialResolver.rawUserInfo(uri) == null) {
            return url;
        }
        StringBuilder builder = new StringBuilder();
        if (uri.getScheme() != null) {
            builder.append(uri.getScheme()).append("://");
        }
        builder.append(REDACTED).append('@');
        if (uri.getHost() != null) {
            builder.append(uri.getHost());
            if (uri.getPort() > 0) {
                builder.append(':').append(uri.getPort());
            }
        } else {
            String authority = uri.getRawAuthority();
            builder.append(authority.substring(authority.lastIndexOf('@') + 1));
        }
        if (uri.getRawPath() != null) {
            builder.append(uri.getRawPath());
        }
        return builder.toString();
    }
}
