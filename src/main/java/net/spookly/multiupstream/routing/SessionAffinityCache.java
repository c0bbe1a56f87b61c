package net.spookly.multiupstream.routing;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.multiupstream.registry.RegistryEvent;
import net.spookly.multiupstream.registry.RegistryEventListener;

/**
 * Remembers which upstream each active session was routed to.
 * <p>
 * Entries are removed on teardown, so the map is bounded by the number of live sessions.
 * A registry change clears the cache.
 */
public final class SessionAffinityCache implements RegistryEventListener {
    private final Map<ConnectionIdentity, UpstreamProxy> entries = new ConcurrentHashMap<>();

    public UpstreamProxy get(ConnectionIdentity identity) {
        if (identity == null) {
            return null;
        }
        return entries.get(identity);
    }

    public void put(ConnectionIdentity identity, UpstreamProxy upstream) {
        if (identity == null || upstream == null) {
            return;
        }
        entries.put(identity, upstream);
    }

    /**
     * Remove the entry only if it still maps to the given upstream.
     */
    public boolean evict(ConnectionIdentity identity, UpstreamProxy expected) {
        if (identity == null || expected == null) {
            return false;
        }
        return entries.remove(identity, expected);
    }

    public UpstreamProxy remove(ConnectionIdentity identity) {
        if (identity == null) {
            return null;
        }
        return entries.remove(identity);
    }

    /**
     * Remove every session belonging to a client address.
     */
    public int evictClient(String clientAddress) {
        if (clientAddress == null) {
            return 0;
        }
        int before = entries.size();
        entries.keySet().removeIf(identity -> clientAddress.equals(identity.clientAddress()));
        return Math.max(0, before - entries.size());
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void onEvent(RegistryEvent event) {
        clear();
    }
}
