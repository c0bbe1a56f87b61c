package net.spookly.multiupstream.tunnel;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import net.spookly.multiupstream.auth.ProxyCredentials;

/**
 * Client side of a SOCKS5 negotiation, driven by the caller one delivery at a time.
 * <p>
 * The handshake performs no I/O. {@link #start()} yields the greeting; every inbound delivery goes
 * through {@link #feed(byte[])}, which consumes at most one server message and tells the caller
 * what to write next. Bytes that arrive after the CONNECT reply are handed back as leftover.
 * Instances are not thread-safe and serve a single connection.
 */
public final class Socks5Handshake {
    private static final byte[] EMPTY = new byte[0];

    private final String targetHost;
    private final int targetPort;
    private final ProxyCredentials credentials;
    private final String proxyLabel;
    private final byte[] connectRequest;
    private final ByteBuf buffer = Unpooled.buffer();

    private HandshakeState state = HandshakeState.GREETING;
    private boolean started;
    private String failureReason;

    public Socks5Handshake(String targetHost, int targetPort, ProxyCredentials credentials) {
        this(targetHost, targetPort, credentials, null);
    }

    /**
     * @param credentials username/password to offer, or null for "no authentication" only
     * @param proxyLabel  upstream description used in failure messages, may be null
     * @throws IllegalArgumentException when the target or credentials cannot be encoded
     */
    public Socks5Handshake(String targetHost, int targetPort, ProxyCredentials credentials, String proxyLabel) {
        this.targetHost = targetHost;
        this.targetPort = targetPort;
        this.credentials = credentials != null && credentials.complete() ? credentials : null;
        this.proxyLabel = proxyLabel;
        if (this.credentials != null && !this.credentials.fitsSocks5()) {
            throw new IllegalArgumentException("SOCKS5 username and password must be at most "
                    + Socks5Protocol.MAX_FIELD_LENGTH + " bytes each");
        }
        this.connectRequest = Socks5Protocol.connectRequest(targetHost, targetPort);
    }

    /**
     * Greeting to send as soon as the upstream connection is open. May be called once.
     */
    public byte[] start() {
        if (started) {
            throw new IllegalStateException("handshake already started");
        }
        started = true;
        return Socks5Protocol.greeting(credentials != null);
    }

    public HandshakeOutcome feed(byte[] data) {
        if (data != null && data.length > 0) {
            appendIfOpen(Unpooled.wrappedBuffer(data));
        }
        return advance();
    }

    /**
     * Feed the readable bytes of {@code data}. The caller keeps ownership of the buffer.
     */
    public HandshakeOutcome feed(ByteBuf data) {
        if (data != null && data.isReadable()) {
            appendIfOpen(data);
        }
        return advance();
    }

    /**
     * Whether bytes past the last handled message are waiting; feed an empty array to process them.
     */
    public boolean hasBufferedInput() {
        return !state.terminal() && buffer.isReadable();
    }

    public HandshakeState state() {
        return state;
    }

    public String failureReason() {
        return failureReason;
    }

    public String targetHost() {
        return targetHost;
    }

    public int targetPort() {
        return targetPort;
    }

    public boolean hasCredentials() {
        return credentials != null;
    }

    /**
     * Drop any buffered bytes. Used when the caller abandons the connection.
     */
    public void close() {
        if (buffer.refCnt() > 0) {
            buffer.release();
        }
    }

    private void appendIfOpen(ByteBuf data) {
        if (!state.terminal()) {
            buffer.writeBytes(data);
        }
    }

    private HandshakeOutcome advance() {
        if (!started) {
            throw new IllegalStateException("handshake not started");
        }
        switch (state) {
            case GREETING:
                return onGreetingReply();
            case AUTHENTICATING:
                return onAuthReply();
            case CONNECTING:
                return onConnectReply();
            case ESTABLISHED:
                return HandshakeOutcome.failed("SOCKS5 handshake already completed");
            case FAILED:
            default:
                return HandshakeOutcome.failed(failureReason);
        }
    }

    private HandshakeOutcome onGreetingReply() {
        if (buffer.readableBytes() < 2) {
            return HandshakeOutcome.needMore(state);
        }
        int version = buffer.getUnsignedByte(buffer.readerIndex());
        int method = buffer.getUnsignedByte(buffer.readerIndex() + 1);
        if (version != Socks5Protocol.VERSION) {
            return fail("Invalid SOCKS version. Expected " + Socks5Protocol.VERSION + ", got " + version);
        }
        switch (method) {
            case Socks5Protocol.METHOD_NO_AUTH:
                buffer.skipBytes(2);
                return transition(HandshakeState.CONNECTING, connectRequest);
            case Socks5Protocol.METHOD_USERNAME_PASSWORD:
                if (credentials == null) {
                    return fail(describeProxy() + " requires username/password authentication,"
                            + " but no credentials are configured");
                }
                buffer.skipBytes(2);
                return transition(HandshakeState.AUTHENTICATING, Socks5Protocol.authRequest(credentials));
            case Socks5Protocol.METHOD_NO_ACCEPTABLE:
                return fail(describeProxy() + " accepted none of the offered authentication methods");
            default:
                return fail("Unsupported SOCKS5 authentication method: " + method);
        }
    }

    private HandshakeOutcome onAuthReply() {
        if (buffer.readableBytes() < 2) {
            return HandshakeOutcome.needMore(state);
        }
        int version = buffer.getUnsignedByte(buffer.readerIndex());
        int status = buffer.getUnsignedByte(buffer.readerIndex() + 1);
        if (version != Socks5Protocol.AUTH_VERSION) {
            return fail("Invalid authentication subnegotiation version. Expected "
                    + Socks5Protocol.AUTH_VERSION + ", got " + version);
        }
        if (status != Socks5Protocol.AUTH_STATUS_SUCCESS) {
            return fail("SOCKS5 authentication failed with status: " + status);
        }
        buffer.skipBytes(2);
        return transition(HandshakeState.CONNECTING, connectRequest);
    }

    // Reply layout: VER REP RSV ATYP ADDR PORT(2). Nothing is consumed until all of it is buffered.
    private HandshakeOutcome onConnectReply() {
        if (buffer.readableBytes() < 4) {
            return HandshakeOutcome.needMore(state);
        }
        int start = buffer.readerIndex();
        int version = buffer.getUnsignedByte(start);
        int reply = buffer.getUnsignedByte(start + 1);
        int reserved = buffer.getUnsignedByte(start + 2);
        int addressType = buffer.getUnsignedByte(start + 3);
        if (version != Socks5Protocol.VERSION) {
            return fail("Invalid SOCKS version in response. Expected " + Socks5Protocol.VERSION + ", got " + version);
        }
        if (reply != Socks5ReplyCode.SUCCEEDED.code()) {
            return fail(describeProxy() + " refused connection: " + Socks5ReplyCode.describe(reply));
        }
        if (reserved != Socks5Protocol.RESERVED) {
            return fail("Invalid reserved byte in SOCKS5 response: " + reserved);
        }
        int domainLength = 0;
        if (addressType == Socks5Protocol.ATYP_DOMAIN) {
            if (buffer.readableBytes() < 5) {
                return HandshakeOutcome.needMore(state);
            }
            domainLength = buffer.getUnsignedByte(start + 4);
        }
        int addressLength = Socks5Protocol.addressLength(addressType, domainLength);
        if (addressLength < 0) {
            return fail("Unsupported address type in SOCKS5 response: " + addressType);
        }
        int total = 4 + addressLength + 2;
        if (buffer.readableBytes() < total) {
            return HandshakeOutcome.needMore(state);
        }
        buffer.skipBytes(total);
        byte[] leftover = buffer.isReadable() ? ByteBufUtil.getBytes(buffer) : EMPTY;
        state = HandshakeState.ESTABLISHED;
        close();
        return HandshakeOutcome.done(leftover);
    }

    private HandshakeOutcome transition(HandshakeState next, byte[] outbound) {
        state = next;
        return HandshakeOutcome.emit(outbound, next);
    }

    private HandshakeOutcome fail(String reason) {
        state = HandshakeState.FAILED;
        failureReason = reason;
        close();
        return HandshakeOutcome.failed(reason);
    }

    private String describeProxy() {
        if (proxyLabel == null || proxyLabel.isEmpty()) {
            return "SOCKS5 proxy";
        }
        return "SOCKS5 proxy " + proxyLabel;
    }
}
