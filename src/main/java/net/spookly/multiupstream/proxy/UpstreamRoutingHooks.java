package net.spookly.multiupstream.proxy;

import java.util.Objects;

import io.netty.handler.codec.http.HttpRequest;
import net.spookly.multiupstream.auth.CredentialInjector;
import net.spookly.multiupstream.auth.CredentialRedactor;
import net.spookly.multiupstream.auth.CredentialResolver;
import net.spookly.multiupstream.routing.SelectionResult;
import net.spookly.multiupstream.routing.UpstreamAddress;
import net.spookly.multiupstream.routing.UpstreamAddressResolver;
import net.spookly.multiupstream.routing.UpstreamProxy;
import net.spookly.multiupstream.routing.UpstreamSelector;
import net.spookly.multiupstream.tunnel.Socks5Handshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flow lifecycle hooks the surrounding proxy calls to route traffic through upstream proxies.
 * <p>
 * A hook that cannot route returns null and leaves the flow without a route, so the proxy applies
 * its own direct-connection policy.
 */
public final class UpstreamRoutingHooks {
    private static final Logger log = LoggerFactory.getLogger(UpstreamRoutingHooks.class);

    private final UpstreamSelector selector;

    public UpstreamRoutingHooks(UpstreamSelector selector) {
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    /**
     * Route a new request and attach header credentials for HTTP upstreams.
     */
    public UpstreamAddress request(ProxiedFlow flow) {
        UpstreamAddress address = route(flow);
        if (address != null) {
            CredentialInjector.inject(flow.upstream(), address, flow.requestHeaders());
        }
        return address;
    }

    /**
     * Route a CONNECT and authenticate the CONNECT request itself as well.
     */
    public UpstreamAddress httpConnect(ProxiedFlow flow, HttpRequest connectRequest) {
        UpstreamAddress address = request(flow);
        if (address != null && connectRequest != null) {
            CredentialInjector.inject(flow.upstream(), address, connectRequest.headers());
        }
        return address;
    }

    public UpstreamAddress websocketStart(ProxiedFlow flow) {
        return request(flow);
    }

    public void websocketEnd(ProxiedFlow flow) {
        selector.release(flow);
    }

    /**
     * Forget every session of a disconnected client.
     */
    public void clientDisconnected(String clientAddress) {
        int evicted = selector.affinityCache().evictClient(clientAddress);
        if (evicted > 0) {
            log.debug("Evicted {} affinity entries for client {}", evicted, clientAddress);
        }
    }

    /**
     * Build the SOCKS5 handshake for a flow routed to a tunnel upstream, or null for other upstreams.
     */
    public Socks5Handshake openTunnel(ProxiedFlow flow) {
        UpstreamAddress via = flow.via();
        if (via == null || !via.scheme().tunnel()) {
            return null;
        }
        try {
            return new Socks5Handshake(
                    flow.targetHost(),
                    flow.targetPort(),
                    CredentialResolver.resolve(flow.upstream()),
                    via.host() + ":" + via.port()
            );
        } catch (IllegalArgumentException e) {
            log.warn("Cannot open SOCKS5 tunnel for {}: {}", flow, e.getMessage());
            return null;
        }
    }

    private UpstreamAddress route(ProxiedFlow flow) {
        Objects.requireNonNull(flow, "flow");
        SelectionResult result = selector.select(flow);
        if (!result.selected()) {
            flow.clearRoute();
            log.debug("No upstream for {} ({})", flow, result.reason());
            return null;
        }
        UpstreamProxy upstream = result.upstream();
        UpstreamAddress address = UpstreamAddressResolver.resolve(upstream.url());
        if (address == null) {
            flow.clearRoute();
            log.warn("Cannot route {} through {}: unsupported proxy url {}",
                    flow, upstream.name(), CredentialRedactor.redactUrl(upstream.url()));
            return null;
        }
        flow.route(upstream, address);
        log.debug("Routing {} via {} ({})", flow, upstream.name(), result.reason());
        return address;
    }
}
