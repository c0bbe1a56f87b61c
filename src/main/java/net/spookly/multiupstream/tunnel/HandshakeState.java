package net.spookly.multiupstream.tunnel;

/**
 * States of the SOCKS5 client negotiation.
 */
public enum HandshakeState {
    /** Greeting sent, waiting for the server's method choice. */
    GREETING,
    /** Username/password sub-negotiation sent, waiting for its status. */
    AUTHENTICATING,
    /** CONNECT request sent, waiting for the reply. */
    CONNECTING,
    /** Tunnel open; bytes now belong to the upper protocol. */
    ESTABLISHED,
    /** Negotiation aborted; the connection must be closed. */
    FAILED;

    public boolean terminal() {
        return this == ESTABLISHED || this == FAILED;
    }
}
