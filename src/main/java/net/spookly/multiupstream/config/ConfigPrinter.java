package net.spookly.multiupstream.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.multiupstream.auth.CredentialRedactor;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with credentials redacted.
 */
public final class ConfigPrinter {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(MultiUpstreamConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactCredentials(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactCredentials(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object proxies = data.get("proxies");
        if (!(proxies instanceof List)) {
            return;
        }
        for (Object entry : (List<?>) proxies) {
            if (!(entry instanceof Map)) {
                continue;
            }
            Map<String, Object> proxy = (Map<String, Object>) entry;
            Object url = proxy.get("url");
            if (url instanceof String) {
                proxy.put("url", CredentialRedactor.redactUrl((String) url));
            }
            Object password = proxy.get("password");
            if (password instanceof String) {
                proxy.put("password", CredentialRedactor.redact((String) password));
            }
        }
    }
}
