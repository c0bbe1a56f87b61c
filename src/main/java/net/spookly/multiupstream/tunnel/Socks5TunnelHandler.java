package net.spookly.multiupstream.tunnel;

import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link Socks5Handshake} over an upstream channel.
 * <p>
 * Sends the greeting once the channel is active and answers each server message. On success the
 * handler removes itself, passes any bytes received after the CONNECT reply to the next handler and
 * then completes the promise. On failure the promise fails and the channel is closed.
 */
public final class Socks5TunnelHandler extends ChannelInboundHandlerAdapter {
    private static final Logger log = LoggerFactory.getLogger(Socks5TunnelHandler.class);
    private static final byte[] EMPTY = new byte[0];

    private final Socks5Handshake handshake;
    private final Promise<Channel> tunnelPromise;
    private boolean greetingSent;

    public Socks5TunnelHandler(Socks5Handshake handshake, Promise<Channel> tunnelPromise) {
        this.handshake = Objects.requireNonNull(handshake, "handshake");
        this.tunnelPromise = Objects.requireNonNull(tunnelPromise, "tunnelPromise");
    }

    public Promise<Channel> tunnelPromise() {
        return tunnelPromise;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        if (ctx.channel().isActive()) {
            sendGreeting(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        sendGreeting(ctx);
        ctx.fireChannelActive();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf)) {
            ctx.fireChannelRead(msg);
            return;
        }
        ByteBuf data = (ByteBuf) msg;
        HandshakeOutcome outcome;
        try {
            outcome = handshake.feed(data);
        } finally {
            data.release();
        }
        while (outcome.kind() == HandshakeOutcome.Kind.EMIT) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(outcome.outbound()));
            if (!handshake.hasBufferedInput()) {
                return;
            }
            outcome = handshake.feed(EMPTY);
        }
        if (outcome.done()) {
            establish(ctx, outcome.leftover());
        } else if (outcome.failed()) {
            abort(ctx, outcome.error());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!handshake.state().terminal()) {
            tunnelPromise.tryFailure(new TunnelHandshakeException(
                    "Upstream closed the connection during SOCKS5 " + handshake.state()));
            handshake.close();
        }
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (tunnelPromise.tryFailure(cause)) {
            handshake.close();
            ctx.close();
            return;
        }
        ctx.fireExceptionCaught(cause);
    }

    private void sendGreeting(ChannelHandlerContext ctx) {
        if (greetingSent) {
            return;
        }
        greetingSent = true;
        ctx.writeAndFlush(Unpooled.wrappedBuffer(handshake.start()));
    }

    private void establish(ChannelHandlerContext ctx, byte[] leftover) {
        log.debug("SOCKS5 tunnel established to {}:{}", handshake.targetHost(), handshake.targetPort());
        ctx.pipeline().remove(this);
        if (leftover.length > 0) {
            ctx.fireChannelRead(Unpooled.wrappedBuffer(leftover));
        }
        tunnelPromise.trySuccess(ctx.channel());
    }

    private void abort(ChannelHandlerContext ctx, String reason) {
        log.warn("SOCKS5 handshake to {}:{} failed: {}", handshake.targetHost(), handshake.targetPort(), reason);
        tunnelPromise.tryFailure(new TunnelHandshakeException(reason));
        ctx.close();
    }
}
