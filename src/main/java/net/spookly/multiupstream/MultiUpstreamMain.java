package net.spookly.multiupstream;

import java.nio.file.Path;
import java.nio.file.Paths;

import net.spookly.multiupstream.config.ConfigLoader;
import net.spookly.multiupstream.config.ConfigPrinter;
import net.spookly.multiupstream.proxy.ProxiedFlow;
import net.spookly.multiupstream.proxy.UpstreamRoutingHooks;
import net.spookly.multiupstream.registry.ProxyRegistry;
import net.spookly.multiupstream.registry.ProxyRegistryStore;
import net.spookly.multiupstream.registry.RegistryAuditLogger;
import net.spookly.multiupstream.registry.UpstreamConfigService;
import net.spookly.multiupstream.routing.UpstreamAddress;
import net.spookly.multiupstream.routing.UpstreamSelector;

/**
 * Command line entry point for checking a proxies configuration and trying routing decisions.
 */
public final class MultiUpstreamMain {
    private static final String DEFAULT_CONFIG_DIR = "config";
    private static final String DEFAULT_CLIENT = "127.0.0.1";

    private MultiUpstreamMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        if (options.printEffectiveConfig) {
            Path file = ConfigLoader.findConfigFile(options.configDir);
            if (file == null) {
                System.err.println("No configuration file found in " + options.configDir);
                return;
            }
            System.out.println(ConfigPrinter.toYaml(ConfigLoader.load(file)));
            return;
        }

        ProxyRegistryStore store = new ProxyRegistryStore();
        store.addListener(RegistryAuditLogger.INSTANCE);
        UpstreamSelector selector = new UpstreamSelector(store);
        store.addListener(selector.affinityCache());
        UpstreamConfigService configService = new UpstreamConfigService(store);
        boolean loaded = configService.reload(options.configDir);

        if (options.dryRun) {
            System.out.println(loaded ? "Config OK (--dry-run)." : "Config not loaded (--dry-run).");
            return;
        }
        ProxyRegistry registry = store.current();
        System.out.println("Multi-upstream config loaded=" + registry.loaded()
                + " candidates=" + registry.candidates().size()
                + " default=" + (registry.defaultProxy() == null ? "-" : registry.defaultProxy().name()));
        if (options.routeTarget == null) {
            return;
        }
        UpstreamRoutingHooks hooks = new UpstreamRoutingHooks(selector);
        ProxiedFlow flow = new ProxiedFlow(
                options.client,
                options.routeTarget.host(),
                options.routeTarget.port(),
                options.websocket
        );
        UpstreamAddress via = options.websocket ? hooks.websocketStart(flow) : hooks.request(flow);
        if (via == null) {
            System.out.println(options.routeTarget + " -> direct");
        } else {
            System.out.println(options.routeTarget + " -> " + flow.upstream().name() + " (" + via + ")");
        }
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        if (args == null) {
            return options;
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config-dir".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    options.configDir = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                options.dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                options.printEffectiveConfig = true;
                continue;
            }
            if ("--websocket".equals(arg)) {
                options.websocket = true;
                continue;
            }
            if ("--client".equals(arg) && i + 1 < args.length) {
                options.client = args[++i];
                continue;
            }
            if ("--route".equals(arg) && i + 1 < args.length) {
                options.routeTarget = RouteTarget.parse(args[++i]);
                continue;
            }
            throw new IllegalArgumentException("Unknown or incomplete argument: " + arg);
        }
        return options;
    }

    static final class CliOptions {
        Path configDir = Paths.get(DEFAULT_CONFIG_DIR);
        boolean dryRun;
        boolean printEffectiveConfig;
        boolean websocket;
        String client = DEFAULT_CLIENT;
        RouteTarget routeTarget;
    }

    static final class RouteTarget {
        private final String host;
        private final int port;

        private RouteTarget(String host, int port) {
            this.host = host;
            this.port = port;
        }

        static RouteTarget parse(String value) {
            int separator = value.lastIndexOf(':');
            if (separator <= 0 || separator == value.length() - 1) {
                throw new IllegalArgumentException("--route expects HOST:PORT, got " + value);
            }
            String host = value.substring(0, separator);
            if (host.startsWith("[") && host.endsWith("]")) {
                host = host.substring(1, host.length() - 1);
            }
            int port;
            try {
                port = Integer.parseInt(value.substring(separator + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--route port is not a number: " + value, e);
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("--route port out of range: " + value);
            }
            return new RouteTarget(host, port);
        }

        String host() {
            return host;
        }

        int port() {
            return port;
        }

        @Override
        public String toString() {
            return host + ":" + port;
        }
    }
}
