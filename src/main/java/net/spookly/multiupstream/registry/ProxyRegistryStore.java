package net.spookly.multiupstream.registry;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current registry snapshot. Readers never see a partially built registry.
 */
public final class ProxyRegistryStore {
    private static final Logger log = LoggerFactory.getLogger(ProxyRegistryStore.class);

    private final AtomicReference<ProxyRegistry> current = new AtomicReference<>(ProxyRegistry.unloaded());
    private final List<RegistryEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public ProxyRegistryStore() {
        this(Clock.systemUTC());
    }

    public ProxyRegistryStore(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ProxyRegistry current() {
        return current.get();
    }

    public void addListener(RegistryEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Swap in a new snapshot and notify listeners.
     */
    public void replace(ProxyRegistry registry) {
        ProxyRegistry next = registry == null ? ProxyRegistry.unloaded() : registry;
        current.set(next);
        emit(RegistryEvent.from(next, clock.instant()));
    }

    /**
     * Discard the current snapshot; selection stops until the next successful load.
     */
    public void unload() {
        replace(ProxyRegistry.unloaded());
    }

    private void emit(RegistryEvent event) {
        for (RegistryEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Failed to emit registry event {}: {}", event.type(), e.getMessage());
            }
        }
    }
}
