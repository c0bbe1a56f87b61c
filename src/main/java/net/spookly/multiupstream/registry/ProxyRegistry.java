package net.spookly.multiupstream.registry;

import java.util.ArrayList;
import java.util.List;

import net.spookly.multiupstream.config.MultiUpstreamConfig;
import net.spookly.multiupstream.routing.Rule;
import net.spookly.multiupstream.routing.RuleType;
import net.spookly.multiupstream.routing.UpstreamProxy;

/**
 * Immutable snapshot of the configured upstream proxies.
 * <p>
 * Proxies carrying a default rule are kept out of {@link #candidates()}; when several do, the last
 * one in file order becomes {@link #defaultProxy()}.
 */
public final class ProxyRegistry {
    private static final ProxyRegistry UNLOADED = new ProxyRegistry(List.of(), null, false, null);

    private final List<UpstreamProxy> candidates;
    private final UpstreamProxy defaultProxy;
    private final boolean loaded;
    private final String source;

    private ProxyRegistry(List<UpstreamProxy> candidates, UpstreamProxy defaultProxy, boolean loaded, String source) {
        this.candidates = List.copyOf(candidates);
        this.defaultProxy = defaultProxy;
        this.loaded = loaded;
        this.source = source;
    }

    public static ProxyRegistry unloaded() {
        return UNLOADED;
    }

    /**
     * Build a loaded registry from upstream definitions in declaration order.
     */
    public static ProxyRegistry of(List<UpstreamProxy> proxies, String source) {
        List<UpstreamProxy> candidates = new ArrayList<>();
        UpstreamProxy defaultProxy = null;
        if (proxies != null) {
            for (UpstreamProxy proxy : proxies) {
                if (proxy == null) {
                    continue;
                }
                if (proxy.isDefault()) {
                    defaultProxy = proxy;
                } else {
                    candidates.add(proxy);
                }
            }
        }
        return new ProxyRegistry(candidates, defaultProxy, true, source);
    }

    /**
     * Build a loaded registry from validated configuration.
     */
    public static ProxyRegistry fromConfig(MultiUpstreamConfig config, String source) {
        List<UpstreamProxy> proxies = new ArrayList<>();
        if (config != null && config.proxies != null) {
            for (MultiUpstreamConfig.ProxyConfig proxy : config.proxies) {
                if (proxy == null) {
                    continue;
                }
                proxies.add(fromProxyConfig(proxy));
            }
        }
        return of(proxies, source);
    }

    static UpstreamProxy fromProxyConfig(MultiUpstreamConfig.ProxyConfig proxy) {
        List<Rule> rules = new ArrayList<>();
        if (proxy.rules != null) {
            for (MultiUpstreamConfig.RuleConfig rule : proxy.rules) {
                Rule converted = fromRuleConfig(rule);
                if (converted != null) {
                    rules.add(converted);
                }
            }
        }
        return new UpstreamProxy(
                proxy.name,
                proxy.url,
                effectiveWeight(proxy.weight),
                rules,
                proxy.username,
                proxy.password
        );
    }

    private static Rule fromRuleConfig(MultiUpstreamConfig.RuleConfig rule) {
        if (rule == null) {
            return null;
        }
        RuleType type = RuleType.fromConfig(rule.type);
        if (type == null) {
            return null;
        }
        switch (type) {
            case HOST_PATTERN:
                return rule.pattern == null || rule.pattern.isEmpty() ? null : Rule.hostPattern(rule.pattern);
            case PORT:
                return rule.port == null || rule.port < 1 || rule.port > 65535 ? null : Rule.port(rule.port);
            case DEFAULT:
            default:
                return Rule.defaultRule();
        }
    }

    private static int effectiveWeight(Integer weight) {
        if (weight == null || weight <= 0) {
            return 1;
        }
        return weight;
    }

    public List<UpstreamProxy> candidates() {
        return candidates;
    }

    public UpstreamProxy defaultProxy() {
        return defaultProxy;
    }

    public boolean loaded() {
        return loaded;
    }

    /**
     * Config file the snapshot was built from, if any.
     */
    public String source() {
        return source;
    }

    /**
     * Look up a proxy by name among candidates and the default.
     */
    public UpstreamProxy find(String name) {
        if (name == null) {
            return null;
        }
        for (UpstreamProxy candidate : candidates) {
            if (name.equals(candidate.name())) {
                return candidate;
            }
        }
        if (defaultProxy != null && name.equals(defaultProxy.name())) {
            return defaultProxy;
        }
        return null;
    }
}
