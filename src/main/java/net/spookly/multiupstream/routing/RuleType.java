package net.spookly.multiupstream.routing;

import java.util.Locale;

/**
 * Rule kinds accepted in the proxies configuration.
 */
public enum RuleType {
    HOST_PATTERN("host_pattern"),
    PORT("port"),
    DEFAULT("default");

    private final String configName;

    RuleType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolve a config value such as {@code host_pattern}, returning null when unknown.
     */
    public static RuleType fromConfig(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RuleType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
