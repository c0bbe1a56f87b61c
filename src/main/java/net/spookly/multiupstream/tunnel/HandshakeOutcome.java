package net.spookly.multiupstream.tunnel;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Result of feeding bytes to a {@link Socks5Handshake}.
 */
@Getter
@Accessors(fluent = true)
public final class HandshakeOutcome {
    private static final byte[] EMPTY = new byte[0];

    public enum Kind {
        /** The current message is incomplete; nothing was consumed. */
        NEED_MORE,
        /** A message was consumed and {@link #outbound()} must be written to the upstream. */
        EMIT,
        /** The tunnel is open; {@link #leftover()} belongs to the upper protocol. */
        DONE,
        /** Protocol violation; {@link #error()} describes it. */
        FAILED
    }

    private final Kind kind;
    private final HandshakeState state;
    private final byte[] outbound;
    private final byte[] leftover;
    private final String error;

    private HandshakeOutcome(Kind kind, HandshakeState state, byte[] outbound, byte[] leftover, String error) {
        this.kind = kind;
        this.state = state;
        this.outbound = outbound;
        this.leftover = leftover;
        this.error = error;
    }

    static HandshakeOutcome needMore(HandshakeState state) {
        return new HandshakeOutcome(Kind.NEED_MORE, state, EMPTY, EMPTY, null);
    }

    static HandshakeOutcome emit(byte[] outbound, HandshakeState next) {
        return new HandshakeOutcome(Kind.EMIT, next, outbound, EMPTY, null);
    }

    static HandshakeOutcome done(byte[] leftover) {
        return new HandshakeOutcome(Kind.DONE, HandshakeState.ESTABLISHED, EMPTY, leftover, null);
    }

    static HandshakeOutcome failed(String reason) {
        return new HandshakeOutcome(Kind.FAILED, HandshakeState.FAILED, EMPTY, EMPTY, reason);
    }

    /**
     * True exactly once per handshake, when the tunnel is established.
     */
    public boolean done() {
        return kind == Kind.DONE;
    }

    public boolean failed() {
        return kind == Kind.FAILED;
    }
}
