package net.spookly.multiupstream.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import net.spookly.multiupstream.config.MultiUpstreamConfig;
import net.spookly.multiupstream.routing.Rule;
import net.spookly.multiupstream.routing.RuleType;
import net.spookly.multiupstream.routing.UpstreamProxy;
import org.junit.jupiter.api.Test;

class ProxyRegistryTest {
    @Test
    void unloadedRegistryHasNoProxies() {
        ProxyRegistry registry = ProxyRegistry.unloaded();

        assertFalse(registry.loaded());
        assertTrue(registry.candidates().isEmpty());
        assertNull(registry.defaultProxy());
    }

    @Test
    void separatesDefaultProxyFromCandidates() {
        UpstreamProxy a = new UpstreamProxy("a", "http://a:8080", 1, List.of(Rule.port(443)));
        UpstreamProxy fallback = new UpstreamProxy("fallback", "http://f:8080", 1, List.of(Rule.defaultRule()));
        UpstreamProxy b = new UpstreamProxy("b", "http://b:8080", 1, List.of(Rule.hostPattern("*.example.com")));

        ProxyRegistry registry = ProxyRegistry.of(List.of(a, fallback, b), "proxies.yaml");

        assertTrue(registry.loaded());
        assertEquals(List.of(a, b), registry.candidates());
        assertEquals("fallback", registry.defaultProxy().name());
        assertEquals(fallback, registry.find("fallback"));
        assertEquals(b, registry.find("b"));
        assertNull(registry.find("missing"));
    }

    @Test
    void lastDefaultProxyWins() {
        ProxyRegistry registry = ProxyRegistry.of(List.of(
                new UpstreamProxy("first", "http://first:8080", 1, List.of(Rule.defaultRule())),
                new UpstreamProxy("second", "http://second:8080", 1, List.of(Rule.defaultRule()))
        ), "test");

        assertEquals("second", registry.defaultProxy().name());
        assertTrue(registry.candidates().isEmpty());
    }

    @Test
    void buildsProxiesFromConfig() {
        MultiUpstreamConfig config = new MultiUpstreamConfig();
        config.proxies = new ArrayList<>();
        MultiUpstreamConfig.ProxyConfig proxy = new MultiUpstreamConfig.ProxyConfig();
        proxy.name = "corp";
        proxy.url = "http://corp:3128";
        proxy.username = "alice";
        proxy.password = "secret";
        proxy.rules = List.of(hostRule("*.corp.example"), portRule(8443));
        config.proxies.add(proxy);

        ProxyRegistry registry = ProxyRegistry.fromConfig(config, "proxies.yaml");

        UpstreamProxy built = registry.candidates().get(0);
        assertEquals("corp", built.name());
        assertEquals(1, built.weight());
        assertEquals("alice", built.username());
        assertEquals(2, built.rules().size());
        assertEquals(RuleType.HOST_PATTERN, built.rules().get(0).type());
        assertEquals(RuleType.PORT, built.rules().get(1).type());
        assertEquals("proxies.yaml", registry.source());
    }

    @Test
    void storeSwapsSnapshotAndNotifiesListeners() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        ProxyRegistryStore store = new ProxyRegistryStore(Clock.fixed(now, ZoneOffset.UTC));
        List<RegistryEvent> events = new ArrayList<>();
        store.addListener(events::add);
        store.addListener(event -> {
            throw new IllegalStateException("boom");
        });

        store.replace(ProxyRegistry.of(List.of(
                new UpstreamProxy("a", "http://a:8080", 1, List.of(Rule.port(443))),
                new UpstreamProxy("d", "http://d:8080", 1, List.of(Rule.defaultRule()))
        ), "proxies.yaml"));
        store.unload();

        assertFalse(store.current().loaded());
        assertEquals(2, events.size());
        RegistryEvent loaded = events.get(0);
        assertEquals(RegistryEventType.LOADED, loaded.type());
        assertEquals(1, loaded.candidates());
        assertEquals("d", loaded.defaultProxy());
        assertEquals(now, loaded.timestamp());
        assertEquals(RegistryEventType.UNLOADED, events.get(1).type());
    }

    private static MultiUpstreamConfig.RuleConfig hostRule(String pattern) {
        MultiUpstreamConfig.RuleConfig rule = new MultiUpstreamConfig.RuleConfig();
        rule.type = "host_pattern";
        rule.pattern = pattern;
        return rule;
    }

    private static MultiUpstreamConfig.RuleConfig portRule(int port) {
        MultiUpstreamConfig.RuleConfig rule = new MultiUpstreamConfig.RuleConfig();
        rule.type = "port";
        rule.port = port;
        return rule;
    }
}
