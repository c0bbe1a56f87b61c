package net.spookly.multiupstream.tunnel;

import java.io.IOException;

/**
 * Signals that a tunnel could not be negotiated with the upstream proxy.
 */
public class TunnelHandshakeException extends IOException {
    public TunnelHandshakeException(String message) {
        super(message);
    }
}
