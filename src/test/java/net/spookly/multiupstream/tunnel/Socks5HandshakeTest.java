package net.spookly.multiupstream.tunnel;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import net.spookly.multiupstream.auth.ProxyCredentials;
import org.junit.jupiter.api.Test;

class Socks5HandshakeTest {
    private static final byte[] NO_AUTH = {0x05, 0x00};
    private static final byte[] IPV4_SUCCESS = {0x05, 0x00, 0x00, 0x01, 10, 0, 0, 1, 0x1f, (byte) 0x90};

    @Test
    void completesWithoutAuthentication() {
        Socks5Handshake handshake = new Socks5Handshake("10.0.0.5", 443, null);
        assertArrayEquals(new byte[]{0x05, 0x01, 0x00}, handshake.start());

        HandshakeOutcome greeting = handshake.feed(NO_AUTH);
        assertEquals(HandshakeOutcome.Kind.EMIT, greeting.kind());
        assertArrayEquals(Socks5Protocol.connectRequest("10.0.0.5", 443), greeting.outbound());
        assertEquals(HandshakeState.CONNECTING, handshake.state());

        HandshakeOutcome connect = handshake.feed(IPV4_SUCCESS);
        assertTrue(connect.done());
        assertEquals(0, connect.leftover().length);
        assertEquals(HandshakeState.ESTABLISHED, handshake.state());
    }

    @Test
    void waitsForSplitGreeting() {
        Socks5Handshake handshake = started("example.com", 443, null);

        assertEquals(HandshakeOutcome.Kind.NEED_MORE, handshake.feed(new byte[]{0x05}).kind());
        assertEquals(HandshakeState.GREETING, handshake.state());

        assertEquals(HandshakeOutcome.Kind.EMIT, handshake.feed(new byte[]{0x00}).kind());
        assertEquals(HandshakeState.CONNECTING, handshake.state());
    }

    @Test
    void authenticatesWithUsernamePassword() {
        Socks5Handshake handshake = new Socks5Handshake("example.com", 443, new ProxyCredentials("bob", "pw"));
        assertArrayEquals(new byte[]{0x05, 0x02, 0x00, 0x02}, handshake.start());

        HandshakeOutcome greeting = handshake.feed(new byte[]{0x05, 0x02});
        assertEquals(HandshakeOutcome.Kind.EMIT, greeting.kind());
        assertEquals(HandshakeState.AUTHENTICATING, handshake.state());
        assertArrayEquals(new byte[]{0x01, 3, 'b', 'o', 'b', 2, 'p', 'w'}, greeting.outbound());

        HandshakeOutcome auth = handshake.feed(new byte[]{0x01, 0x00});
        assertEquals(HandshakeOutcome.Kind.EMIT, auth.kind());
        assertEquals(HandshakeState.CONNECTING, handshake.state());

        assertTrue(handshake.feed(IPV4_SUCCESS).done());
    }

    @Test
    void serverMayStillChooseNoAuthWhenCredentialsOffered() {
        Socks5Handshake handshake = started("example.com", 443, new ProxyCredentials("bob", "pw"));

        handshake.feed(NO_AUTH);

        assertEquals(HandshakeState.CONNECTING, handshake.state());
    }

    @Test
    void incompleteCredentialsAreNotOffered() {
        Socks5Handshake handshake = new Socks5Handshake("example.com", 443, new ProxyCredentials("bob", ""));

        assertFalse(handshake.hasCredentials());
        assertArrayEquals(new byte[]{0x05, 0x01, 0x00}, handshake.start());
    }

    @Test
    void failsWhenPasswordRequiredButNotConfigured() {
        Socks5Handshake handshake = new Socks5Handshake("example.com", 443, null, "socks.local:1080");
        handshake.start();

        HandshakeOutcome outcome = handshake.feed(new byte[]{0x05, 0x02});

        assertTrue(outcome.failed());
        assertTrue(outcome.error().contains("socks.local:1080"));
        assertTrue(outcome.error().contains("no credentials"));
        assertEquals(HandshakeState.FAILED, handshake.state());
    }

    @Test
    void failsOnRejectedMethodsAndBadVersions() {
        assertTrue(started("example.com", 443, null).feed(new byte[]{0x05, (byte) 0xFF}).error()
                .contains("none of the offered authentication methods"));
        assertTrue(started("example.com", 443, null).feed(new byte[]{0x04, 0x00}).error()
                .contains("Invalid SOCKS version"));
        assertTrue(started("example.com", 443, null).feed(new byte[]{0x05, 0x01}).error()
                .contains("Unsupported SOCKS5 authentication method"));
    }

    @Test
    void failsOnAuthenticationRejection() {
        Socks5Handshake handshake = started("example.com", 443, new ProxyCredentials("bob", "pw"));
        handshake.feed(new byte[]{0x05, 0x02});

        HandshakeOutcome outcome = handshake.feed(new byte[]{0x01, 0x01});

        assertTrue(outcome.failed());
        assertEquals("SOCKS5 authentication failed with status: 1", outcome.error());
        assertEquals(outcome.error(), handshake.failureReason());
    }

    @Test
    void reportsRefusedConnection() {
        Socks5Handshake handshake = started("example.com", 443, null);
        handshake.feed(NO_AUTH);

        HandshakeOutcome outcome = handshake.feed(new byte[]{0x05, 0x05, 0x00, 0x01, 0, 0, 0, 0, 0, 0});

        assertTrue(outcome.failed());
        assertTrue(outcome.error().contains("refused"));
        assertTrue(outcome.error().contains("Connection refused"));
    }

    @Test
    void waitsForWholeDomainReply() {
        Socks5Handshake handshake = started("example.com", 443, null);
        handshake.feed(NO_AUTH);

        // Domain length 10, only 8 of its bytes buffered.
        byte[] partial = {0x05, 0x00, 0x00, 0x03, 10, 'a', 'b', 'c', 'd', 'e', 'f', 'g', 'h'};
        assertEquals(HandshakeOutcome.Kind.NEED_MORE, handshake.feed(partial).kind());
        assertEquals(HandshakeState.CONNECTING, handshake.state());

        HandshakeOutcome rest = handshake.feed(new byte[]{'i', 'j', 0x01, (byte) 0xbb});
        assertTrue(rest.done());
        assertEquals(0, rest.leftover().length);
    }

    @Test
    void waitsForDomainLengthByte() {
        Socks5Handshake handshake = started("example.com", 443, null);
        handshake.feed(NO_AUTH);

        assertEquals(HandshakeOutcome.Kind.NEED_MORE,
                handshake.feed(new byte[]{0x05, 0x00, 0x00, 0x03}).kind());
    }

    @Test
    void preservesBytesAfterConnectReply() {
        Socks5Handshake handshake = started("example.com", 443, null);
        handshake.feed(NO_AUTH);

        byte[] reply = {0x05, 0x00, 0x00, 0x01, 10, 0, 0, 1, 0x1f, (byte) 0x90, 0x16, 0x03};
        HandshakeOutcome outcome = handshake.feed(reply);

        assertTrue(outcome.done());
        assertArrayEquals(new byte[]{0x16, 0x03}, outcome.leftover());
    }

    @Test
    void handlesIpv6Reply() {
        Socks5Handshake handshake = started("example.com", 443, null);
        handshake.feed(NO_AUTH);
        byte[] reply = new byte[4 + 16 + 2];
        reply[0] = 0x05;
        reply[3] = 0x04;

        assertTrue(handshake.feed(reply).done());
    }

    @Test
    void rejectsUnknownAddressTypeAndReservedByte() {
        Socks5Handshake unknownType = started("example.com", 443, null);
        unknownType.feed(NO_AUTH);
        assertTrue(unknownType.feed(new byte[]{0x05, 0x00, 0x00, 0x02, 0, 0}).error()
                .contains("Unsupported address type"));

        Socks5Handshake badReserved = started("example.com", 443, null);
        badReserved.feed(NO_AUTH);
        assertTrue(badReserved.feed(new byte[]{0x05, 0x00, 0x01, 0x01}).error()
                .contains("reserved"));
    }

    @Test
    void processesOneMessagePerFeed() {
        Socks5Handshake handshake = started("example.com", 443, new ProxyCredentials("bob", "pw"));

        HandshakeOutcome first = handshake.feed(new byte[]{0x05, 0x02, 0x01, 0x00});
        assertEquals(HandshakeState.AUTHENTICATING, first.state());
        assertTrue(handshake.hasBufferedInput());

        HandshakeOutcome second = handshake.feed(new byte[0]);
        assertEquals(HandshakeState.CONNECTING, second.state());
        assertFalse(handshake.hasBufferedInput());
    }

    @Test
    void feedsFromByteBufWithoutTakingOwnership() {
        Socks5Handshake handshake = started("example.com", 443, null);
        ByteBuf data = Unpooled.wrappedBuffer(NO_AUTH);
        try {
            handshake.feed(data);

            assertEquals(1, data.refCnt());
            assertEquals(HandshakeState.CONNECTING, handshake.state());
        } finally {
            data.release();
        }
    }

    @Test
    void staysFailedAfterTerminalState() {
        Socks5Handshake handshake = started("example.com", 443, null);
        handshake.feed(new byte[]{0x05, (byte) 0xFF});

        HandshakeOutcome again = handshake.feed(NO_AUTH);

        assertTrue(again.failed());
        assertEquals(HandshakeState.FAILED, handshake.state());
    }

    @Test
    void enforcesLifecycleAndLimits() {
        Socks5Handshake handshake = new Socks5Handshake("example.com", 443, null);
        assertThrows(IllegalStateException.class, () -> handshake.feed(NO_AUTH));
        handshake.start();
        assertThrows(IllegalStateException.class, handshake::start);

        assertThrows(IllegalArgumentException.class,
                () -> new Socks5Handshake("example.com", 443, new ProxyCredentials("u".repeat(256), "pw")));
    }

    private static Socks5Handshake started(String host, int port, ProxyCredentials credentials) {
        Socks5Handshake handshake = new Socks5Handshake(host, port, credentials);
        handshake.start();
        return handshake;
    }
}
