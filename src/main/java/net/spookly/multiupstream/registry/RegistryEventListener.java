package net.spookly.multiupstream.registry;

/**
 * Listener for registry replacement events.
 */
@FunctionalInterface
public interface RegistryEventListener {
    RegistryEventListener NOOP = event -> {
    };

    void onEvent(RegistryEvent event);
}
