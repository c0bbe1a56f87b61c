package net.spookly.multiupstream.tunnel;

import java.net.IDN;
import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.util.NetUtil;
import net.spookly.multiupstream.auth.ProxyCredentials;

/**
 * SOCKS5 constants and client-side message encoders.
 */
public final class Socks5Protocol {
    public static final int VERSION = 0x05;
    public static final int AUTH_VERSION = 0x01;

    public static final int METHOD_NO_AUTH = 0x00;
    public static final int METHOD_USERNAME_PASSWORD = 0x02;
    public static final int METHOD_NO_ACCEPTABLE = 0xFF;

    public static final int CMD_CONNECT = 0x01;
    public static final int RESERVED = 0x00;

    public static final int ATYP_IPV4 = 0x01;
    public static final int ATYP_DOMAIN = 0x03;
    public static final int ATYP_IPV6 = 0x04;

    public static final int AUTH_STATUS_SUCCESS = 0x00;

    static final int MAX_FIELD_LENGTH = 255;

    private Socks5Protocol() {
    }

    /**
     * Greeting offering "no authentication", plus "username/password" when credentials are configured.
     */
    public static byte[] greeting(boolean withCredentials) {
        if (withCredentials) {
            return new byte[]{VERSION, 2, METHOD_NO_AUTH, METHOD_USERNAME_PASSWORD};
        }
        return new byte[]{VERSION, 1, METHOD_NO_AUTH};
    }

    /**
     * Username/password sub-negotiation request (RFC 1929).
     */
    public static byte[] authRequest(ProxyCredentials credentials) {
        byte[] username = credentials.username().getBytes(StandardCharsets.UTF_8);
        byte[] password = credentials.password().getBytes(StandardCharsets.UTF_8);
        requireFieldLength(username.length, "username");
        requireFieldLength(password.length, "password");
        ByteBuf out = Unpooled.buffer(3 + username.length + password.length);
        try {
            out.writeByte(AUTH_VERSION);
            out.writeByte(username.length);
            out.writeBytes(username);
            out.writeByte(password.length);
            out.writeBytes(password);
            return ByteBufUtil.getBytes(out);
        } finally {
            out.release();
        }
    }

    /**
     * CONNECT request for the target. IPv4 and IPv6 literals are sent as addresses, anything else
     * as a domain name.
     */
    public static byte[] connectRequest(String host, int port) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("target host is required");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("target port out of range: " + port);
        }
        ByteBuf out = Unpooled.buffer();
        try {
            out.writeByte(VERSION);
            out.writeByte(CMD_CONNECT);
            out.writeByte(RESERVED);
            writeAddress(out, host);
            out.writeShort(port);
            return ByteBufUtil.getBytes(out);
        } finally {
            out.release();
        }
    }

    private static void writeAddress(ByteBuf out, String host) {
        if (NetUtil.isValidIpV4Address(host)) {
            out.writeByte(ATYP_IPV4);
            out.writeBytes(NetUtil.createByteArrayFromIpAddressString(host));
            return;
        }
        String literal = stripBrackets(host);
        if (NetUtil.isValidIpV6Address(literal)) {
            out.writeByte(ATYP_IPV6);
            out.writeBytes(NetUtil.createByteArrayFromIpAddressString(literal));
            return;
        }
        byte[] domain = toAscii(host);
        requireFieldLength(domain.length, "target host");
        out.writeByte(ATYP_DOMAIN);
        out.writeByte(domain.length);
        out.writeBytes(domain);
    }

    /**
     * Size in bytes of the address field for an address type, or -1 when the type is unknown.
     * Domain names need the length byte, passed as {@code domainLength}.
     */
    static int addressLength(int addressType, int domainLength) {
        switch (addressType) {
            case ATYP_IPV4:
                return 4;
            case ATYP_IPV6:
                return 16;
            case ATYP_DOMAIN:
                return 1 + domainLength;
            default:
                return -1;
        }
    }

    private static byte[] toAscii(String host) {
        try {
            return IDN.toASCII(host, IDN.ALLOW_UNASSIGNED).getBytes(StandardCharsets.US_ASCII);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("target host is not a valid domain name: " + host, e);
        }
    }

    private static String stripBrackets(String host) {
        if (host.length() > 2 && host.charAt(0) == '[' && host.charAt(host.length() - 1) == ']') {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static void requireFieldLength(int length, String field) {
        if (length > MAX_FIELD_LENGTH) {
            throw new IllegalArgumentException(field + " exceeds " + MAX_FIELD_LENGTH + " bytes");
        }
    }
}
