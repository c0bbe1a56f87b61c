package net.spookly.multiupstream.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import net.spookly.multiupstream.registry.ProxyRegistry;
import net.spookly.multiupstream.registry.RegistryEvent;
import org.junit.jupiter.api.Test;

class SessionAffinityCacheTest {
    private static final UpstreamProxy A = new UpstreamProxy("a", "http://a:8080", 1, List.of(Rule.port(443)));
    private static final UpstreamProxy B = new UpstreamProxy("b", "http://b:8080", 1, List.of(Rule.port(443)));

    @Test
    void identityIncludesPortForRequestFlows() {
        ConnectionIdentity https = ConnectionIdentity.of(new FakeFlow("10.0.0.1", "example.com", 443, false));
        ConnectionIdentity http = ConnectionIdentity.of(new FakeFlow("10.0.0.1", "example.com", 80, false));

        assertNotEquals(https, http);
        assertEquals("10.0.0.1->example.com:443", https.toString());
    }

    @Test
    void identityIgnoresPortForWebsocketFlows() {
        ConnectionIdentity first = ConnectionIdentity.of(new FakeFlow("10.0.0.1", "example.com", 443, true));
        ConnectionIdentity second = ConnectionIdentity.of(new FakeFlow("10.0.0.1", "example.com", 8443, true));

        assertEquals(first, second);
        assertNull(first.targetPort());
        assertEquals("10.0.0.1->example.com", first.toString());
    }

    @Test
    void evictOnlyRemovesExpectedUpstream() {
        SessionAffinityCache cache = new SessionAffinityCache();
        ConnectionIdentity identity = identity("10.0.0.1", "example.com");
        cache.put(identity, A);

        assertFalse(cache.evict(identity, B));
        assertSame(A, cache.get(identity));
        assertTrue(cache.evict(identity, A));
        assertNull(cache.get(identity));
    }

    @Test
    void evictClientRemovesAllSessionsOfClient() {
        SessionAffinityCache cache = new SessionAffinityCache();
        cache.put(identity("10.0.0.1", "a.example.com"), A);
        cache.put(identity("10.0.0.1", "b.example.com"), B);
        cache.put(identity("10.0.0.2", "a.example.com"), A);

        assertEquals(2, cache.evictClient("10.0.0.1"));
        assertEquals(1, cache.size());
        assertEquals(0, cache.evictClient("10.0.0.9"));
    }

    @Test
    void ignoresNullKeys() {
        SessionAffinityCache cache = new SessionAffinityCache();
        cache.put(null, A);
        cache.put(identity("10.0.0.1", "example.com"), null);

        assertEquals(0, cache.size());
        assertNull(cache.get(null));
        assertNull(cache.remove(null));
    }

    @Test
    void registryEventClearsCache() {
        SessionAffinityCache cache = new SessionAffinityCache();
        cache.put(identity("10.0.0.1", "example.com"), A);

        cache.onEvent(RegistryEvent.from(ProxyRegistry.of(List.of(A), "test"), Instant.EPOCH));

        assertEquals(0, cache.size());
    }

    private static ConnectionIdentity identity(String client, String host) {
        return ConnectionIdentity.of(new FakeFlow(client, host, 443, false));
    }
}
