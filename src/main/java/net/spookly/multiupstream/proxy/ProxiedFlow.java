package net.spookly.multiupstream.proxy;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.multiupstream.routing.FlowView;
import net.spookly.multiupstream.routing.UpstreamAddress;
import net.spookly.multiupstream.routing.UpstreamProxy;

/**
 * A flow as handed over by the surrounding proxy, plus the routing target recorded for it.
 */
@Getter
@Accessors(fluent = true)
public final class ProxiedFlow implements FlowView {
    private final String clientAddress;
    private final String targetHost;
    private final int targetPort;
    private final boolean websocket;
    /**
     * Outgoing request headers; credentials for header-authenticated upstreams land here.
     */
    private final HttpHeaders requestHeaders;
    private volatile UpstreamProxy upstream;
    private volatile UpstreamAddress via;

    public ProxiedFlow(String clientAddress, String targetHost, int targetPort, boolean websocket) {
        this(clientAddress, targetHost, targetPort, websocket, new DefaultHttpHeaders());
    }

    public ProxiedFlow(String clientAddress,
                       String targetHost,
                       int targetPort,
                       boolean websocket,
                       HttpHeaders requestHeaders) {
        this.clientAddress = clientAddress;
        this.targetHost = targetHost;
        this.targetPort = targetPort;
        this.websocket = websocket;
        this.requestHeaders = requestHeaders == null ? new DefaultHttpHeaders() : requestHeaders;
    }

    void route(UpstreamProxy upstream, UpstreamAddress via) {
        this.upstream = upstream;
        this.via = via;
    }

    void clearRoute() {
        this.upstream = null;
        this.via = null;
    }

    @Override
    public String toString() {
        return "ProxiedFlow{" + clientAddress + " -> " + targetHost + ":" + targetPort
                + (websocket ? " ws" : "") + (via == null ? "" : " via " + via) + "}";
    }
}
