package net.spookly.multiupstream.auth;

import java.nio.charset.StandardCharsets;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Username and password pair for an upstream proxy.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
public final class ProxyCredentials {
    /**
     * Longest username or password a SOCKS5 sub-negotiation can carry, in bytes.
     */
    public static final int MAX_SOCKS5_FIELD_BYTES = 255;

    private final String username;
    private final String password;

    /**
     * Whether both username and password are present and non-empty.
     */
    public boolean complete() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }

    /**
     * Whether both fields fit the single length byte of the SOCKS5 sub-negotiation.
     */
    public boolean fitsSocks5() {
        return byteLength(username) <= MAX_SOCKS5_FIELD_BYTES && byteLength(password) <= MAX_SOCKS5_FIELD_BYTES;
    }

    private static int byteLength(String value) {
        return value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public String toString() {
        return "ProxyCredentials{username=" + username + ", password=" + CredentialRedactor.redact(password) + "}";
    }
}
