package net.spookly.multiupstream.routing;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Routing predicate over a flow. One subclass per {@link RuleType}; the set is closed.
 */
public abstract class Rule {
    private Rule() {
    }

    public abstract RuleType type();

    abstract boolean test(FlowView flow);

    public static HostPattern hostPattern(String pattern) {
        return new HostPattern(pattern);
    }

    public static Port port(int port) {
        return new Port(port);
    }

    public static Default defaultRule() {
        return Default.INSTANCE;
    }

    /**
     * Substring match of a wildcard pattern against the target host.
     * <p>
     * The search is not anchored, so {@code example.com} also matches
     * {@code evil-example.com.attacker.net}.
     */
    public static final class HostPattern extends Rule {
        private final String pattern;
        private final Pattern compiled;

        private HostPattern(String pattern) {
            this.pattern = Objects.requireNonNull(pattern, "pattern");
            this.compiled = compile(pattern);
        }

        public String pattern() {
            return pattern;
        }

        @Override
        public RuleType type() {
            return RuleType.HOST_PATTERN;
        }

        @Override
        boolean test(FlowView flow) {
            String host = flow.targetHost();
            if (host == null) {
                return false;
            }
            return compiled.matcher(host).find();
        }

        static Pattern compile(String pattern) {
            StringBuilder regex = new StringBuilder();
            String[] literals = pattern.split("\\*", -1);
            for (int i = 0; i < literals.length; i++) {
                if (i > 0) {
                    regex.append(".*");
                }
                if (!literals[i].isEmpty()) {
                    regex.append(Pattern.quote(literals[i]));
                }
            }
            return Pattern.compile(regex.toString());
        }

        @Override
        public String toString() {
            return "host_pattern(" + pattern + ")";
        }
    }

    /**
     * Exact match on the target port.
     */
    public static final class Port extends Rule {
        private final int port;

        private Port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
        }

        public int port() {
            return port;
        }

        @Override
        public RuleType type() {
            return RuleType.PORT;
        }

        @Override
        boolean test(FlowView flow) {
            return flow.targetPort() == port;
        }

        @Override
        public String toString() {
            return "port(" + port + ")";
        }
    }

    /**
     * Unconditional match. Proxies carrying it become the registry fallback.
     */
    public static final class Default extends Rule {
        private static final Default INSTANCE = new Default();

        private Default() {
        }

        @Override
        public RuleType type() {
            return RuleType.DEFAULT;
        }

        @Override
        boolean test(FlowView flow) {
            return true;
        }

        @Override
        public String toString() {
            return "default";
        }
    }
}
