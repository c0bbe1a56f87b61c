package net.spookly.multiupstream.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import net.spookly.multiupstream.auth.CredentialRedactor;
import net.spookly.multiupstream.auth.CredentialResolver;
import net.spookly.multiupstream.routing.RuleType;
import net.spookly.multiupstream.routing.UpstreamAddressResolver;

/**
 * Collects non-fatal configuration warnings (unreachable proxies, ambiguous defaults, exposed secrets).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(MultiUpstreamConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null || config.proxies == null) {
            return warnings;
        }
        List<String> defaults = new ArrayList<>();
        boolean hasCredentials = false;
        for (int i = 0; i < config.proxies.size(); i++) {
            MultiUpstreamConfig.ProxyConfig proxy = config.proxies.get(i);
            if (proxy == null) {
                continue;
            }
            String label = "proxies[" + i + "] (" + proxy.name + ")";
            if (proxy.rules == null || proxy.rules.isEmpty()) {
                warnings.add(label + " has no rules and will never be selected");
            } else if (hasDefaultRule(proxy)) {
                defaults.add(proxy.name);
                if (proxy.rules.size() > 1) {
                    warnings.add(label + " has a default rule; its other rules are ignored");
                }
            }
            if (UpstreamAddressResolver.resolve(proxy.url) == null) {
                warnings.add(label + " url is not a supported upstream: " + CredentialRedactor.redactUrl(proxy.url));
            }
            if (CredentialResolver.resolve(proxy.url, proxy.username, proxy.password) != null) {
                hasCredentials = true;
            }
        }
        if (defaults.size() > 1) {
            warnings.add("multiple default proxies declared " + defaults
                    + "; the last one (" + defaults.get(defaults.size() - 1) + ") is used");
        }
        if (hasCredentials) {
            warnIfWorldReadable(warnings, configPath);
        }
        return warnings;
    }

    private static boolean hasDefaultRule(MultiUpstreamConfig.ProxyConfig proxy) {
        for (MultiUpstreamConfig.RuleConfig rule : proxy.rules) {
            if (rule != null && RuleType.fromConfig(rule.type) == RuleType.DEFAULT) {
                return true;
            }
        }
        return false;
    }

    private static void warnIfWorldReadable(List<String> warnings, Path configPath) {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(configPath, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            if (permissions.contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add("config file holds proxy credentials and is world-readable: " + configPath);
            }
        } catch (IOException ignored) {
            // Permissions are advisory only.
        }
    }
}
