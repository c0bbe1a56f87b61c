package net.spookly.multiupstream.tunnel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import net.spookly.multiupstream.auth.ProxyCredentials;
import net.spookly.multiupstream.routing.UpstreamAddress;

/**
 * Opens upstream channels through a SOCKS5 proxy.
 */
public final class TunnelConnector {
    public static final String HANDSHAKE_HANDLER = "socks5-handshake";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

    private final EventLoopGroup group;
    private final Class<? extends Channel> channelClass;
    private final int connectTimeoutMs;

    public TunnelConnector(EventLoopGroup group, Class<? extends Channel> channelClass) {
        this(group, channelClass, DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public TunnelConnector(EventLoopGroup group, Class<? extends Channel> channelClass, int connectTimeoutMs) {
        this.group = Objects.requireNonNull(group, "group");
        this.channelClass = Objects.requireNonNull(channelClass, "channelClass");
        this.connectTimeoutMs = connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS;
    }

    /**
     * Connect to a resolved SOCKS5 upstream and open a tunnel to the target.
     */
    public Future<Channel> connect(UpstreamAddress upstream,
                                   String targetHost,
                                   int targetPort,
                                   ProxyCredentials credentials,
                                   ChannelHandler upperLayer) {
        if (upstream == null || !upstream.scheme().tunnel()) {
            throw new IllegalArgumentException("upstream is not a tunnel proxy: " + upstream);
        }
        SocketAddress address = InetSocketAddress.createUnresolved(upstream.host(), upstream.port());
        return connect(address, upstream.host() + ":" + upstream.port(), targetHost, targetPort, credentials, upperLayer);
    }

    /**
     * Connect to {@code proxyAddress} and negotiate a tunnel to {@code targetHost:targetPort}.
     * <p>
     * {@code upperLayer} (optional) is installed behind the handshake handler so it receives any
     * bytes the proxy sends right after its CONNECT reply. The returned future completes with the
     * channel once the tunnel is open.
     */
    public Future<Channel> connect(SocketAddress proxyAddress,
                                   String proxyLabel,
                                   String targetHost,
                                   int targetPort,
                                   ProxyCredentials credentials,
                                   ChannelHandler upperLayer) {
        Socks5Handshake handshake = new Socks5Handshake(targetHost, targetPort, credentials, proxyLabel);
        EventLoop loop = group.next();
        Promise<Channel> promise = loop.newPromise();
        Bootstrap bootstrap = new Bootstrap()
                .group(loop)
                .channel(channelClass)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline().addLast(HANDSHAKE_HANDLER, new Socks5TunnelHandler(handshake, promise));
                        if (upperLayer != null) {
                            ch.pipeline().addLast(upperLayer);
                        }
                    }
                });
        bootstrap.connect(proxyAddress).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                handshake.close();
                promise.tryFailure(future.cause());
            }
        });
        return promise;
    }
}
