package net.spookly.multiupstream.routing;

/**
 * Read-only view of the flow attributes that routing decisions may depend on.
 */
public interface FlowView {
    /**
     * Target host of the flow, or {@code null} when the flow has no usable host.
     */
    String targetHost();

    /**
     * Target port of the flow, or {@code 0} when the flow has no port.
     */
    int targetPort();

    /**
     * Whether the flow is a WebSocket session rather than a single request/response exchange.
     */
    boolean websocket();

    /**
     * Client address the flow originated from.
     */
    String clientAddress();
}
