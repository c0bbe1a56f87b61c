package net.spookly.multiupstream.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.spookly.multiupstream.auth.CredentialResolver;
import net.spookly.multiupstream.auth.ProxyCredentials;
import net.spookly.multiupstream.routing.RuleType;
import net.spookly.multiupstream.routing.UpstreamAddress;
import net.spookly.multiupstream.routing.UpstreamAddressResolver;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException listing every violation.
     */
    public static void validate(MultiUpstreamConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }
        if (config.proxies == null) {
            errors.add("No 'proxies' section found in configuration");
            throwIfErrors(errors);
            return;
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < config.proxies.size(); i++) {
            validateProxy(config.proxies.get(i), "proxies[" + i + "]", names, errors);
        }

        throwIfErrors(errors);
    }

    private static void validateProxy(MultiUpstreamConfig.ProxyConfig proxy,
                                      String path,
                                      Set<String> names,
                                      List<String> errors) {
        if (proxy == null) {
            errors.add(path + " must not be empty");
            return;
        }
        if (isBlank(proxy.name)) {
            errors.add(path + ".name is required");
        } else if (!names.add(proxy.name)) {
            errors.add(path + ".name must be unique: " + proxy.name);
        }
        requireNonBlank(errors, proxy.url, path + ".url");
        if (proxy.weight != null && proxy.weight <= 0) {
            errors.add(path + ".weight must be greater than 0");
        }
        validateCredentials(proxy, path, errors);

        if (proxy.rules == null) {
            return;
        }
        for (int i = 0; i < proxy.rules.size(); i++) {
            validateRule(proxy.rules.get(i), path + ".rules[" + i + "]", errors);
        }
    }

    private static void validateRule(MultiUpstreamConfig.RuleConfig rule, String path, List<String> errors) {
        if (rule == null) {
            errors.add(path + " must not be empty");
            return;
        }
        RuleType type = RuleType.fromConfig(rule.type);
        if (type == null) {
            errors.add(path + ".type must be one of: host_pattern, port, default");
            return;
        }
        switch (type) {
            case HOST_PATTERN:
                requireNonBlank(errors, rule.pattern, path + ".pattern");
                break;
            case PORT:
                requirePort(errors, rule.port, path + ".port");
                break;
            case DEFAULT:
            default:
                break;
        }
    }

    private static void validateCredentials(MultiUpstreamConfig.ProxyConfig proxy, String path, List<String> errors) {
        UpstreamAddress address = UpstreamAddressResolver.resolve(proxy.url);
        if (address == null || !address.scheme().tunnel()) {
            return;
        }
        ProxyCredentials credentials = CredentialResolver.resolve(proxy.url, proxy.username, proxy.password);
        if (credentials != null && !credentials.fitsSocks5()) {
            errors.add(path + " credentials must be at most "
                    + ProxyCredentials.MAX_SOCKS5_FIELD_BYTES + " bytes each for socks5 upstreams");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String path) {
        if (isBlank(value)) {
            errors.add(path + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String path) {
        if (value == null) {
            errors.add(path + " is required");
            return;
        }
        if (value < 1 || value > 65535) {
            errors.add(path + " must be between 1 and 65535");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
