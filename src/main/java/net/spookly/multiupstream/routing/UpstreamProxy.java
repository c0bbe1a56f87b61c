package net.spookly.multiupstream.routing;

import java.util.List;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable upstream proxy definition built from configuration.
 */
@Getter
@Accessors(fluent = true)
public final class UpstreamProxy {
    private final String name;
    private final String url;
    private final int weight;
    private final List<Rule> rules;
    /**
     * Fallback username when the URL carries no user-info.
     */
    private final String username;
    /**
     * Fallback password when the URL carries no user-info.
     */
    private final String password;

    public UpstreamProxy(String name, String url, int weight, List<Rule> rules, String username, String password) {
        this.name = name;
        this.url = url;
        this.weight = weight <= 0 ? 1 : weight;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.username = username;
        this.password = password;
    }

    public UpstreamProxy(String name, String url, int weight, List<Rule> rules) {
        this(name, url, weight, rules, null, null);
    }

    /**
     * Whether any rule is the unconditional default rule.
     */
    public boolean isDefault() {
        for (Rule rule : rules) {
            if (rule.type() == RuleType.DEFAULT) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "UpstreamProxy{name=" + name + ", weight=" + weight + ", rules=" + rules + "}";
    }
}
