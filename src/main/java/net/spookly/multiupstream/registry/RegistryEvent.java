package net.spookly.multiupstream.registry;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of a registry replacement for audit logging.
 */
@Value
@Accessors(fluent = true)
public class RegistryEvent {
    RegistryEventType type;
    Instant timestamp;
    String source;
    int candidates;
    String defaultProxy;

    public static RegistryEvent from(ProxyRegistry registry, Instant timestamp) {
        if (!registry.loaded()) {
            return new RegistryEvent(RegistryEventType.UNLOADED, timestamp, null, 0, null);
        }
        return new RegistryEvent(
                RegistryEventType.LOADED,
                timestamp,
                registry.source(),
                registry.candidates().size(),
                registry.defaultProxy() == null ? null : registry.defaultProxy().name()
        );
    }
}
