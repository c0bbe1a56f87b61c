package net.spookly.multiupstream.routing;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Resolved upstream endpoint: scheme plus host and port.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
public final class UpstreamAddress {
    private final UpstreamScheme scheme;
    private final String host;
    private final int port;

    @Override
    public String toString() {
        return scheme.scheme() + "://" + host + ":" + port;
    }
}
