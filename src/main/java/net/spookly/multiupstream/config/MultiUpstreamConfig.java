package net.spookly.multiupstream.config;

import java.util.List;

public class MultiUpstreamConfig {
    public List<ProxyConfig> proxies;

    public static class ProxyConfig {
        public String name;
        /**
         * scheme://[user:pass@]host[:port]
         */
        public String url;
        public Integer weight;
        public String username;
        public String password;
        public List<RuleConfig> rules;
    }

    public static class RuleConfig {
        /**
         * One of host_pattern, port, default.
         */
        public String type;
        public String pattern;
        public Integer port;
        /**
         * Free-form marker for default rules, conventionally true.
         */
        public Object value;
    }
}
