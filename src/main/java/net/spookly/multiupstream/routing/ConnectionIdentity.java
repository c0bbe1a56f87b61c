package net.spookly.multiupstream.routing;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Affinity key for a logical client-to-target session.
 * <p>
 * WebSocket flows key on client and host; request/response flows also include the port.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class ConnectionIdentity {
    private final String clientAddress;
    private final String targetHost;
    /**
     * Target port, or null for tunnel-oriented flows.
     */
    private final Integer targetPort;

    private ConnectionIdentity(String clientAddress, String targetHost, Integer targetPort) {
        this.clientAddress = clientAddress;
        this.targetHost = targetHost;
        this.targetPort = targetPort;
    }

    public static ConnectionIdentity of(FlowView flow) {
        if (flow.websocket()) {
            return new ConnectionIdentity(flow.clientAddress(), flow.targetHost(), null);
        }
        return new ConnectionIdentity(flow.clientAddress(), flow.targetHost(), flow.targetPort());
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(clientAddress).append("->").append(targetHost);
        if (targetPort != null) {
            builder.append(':').append(targetPort);
        }
        return builder.toString();
    }
}
