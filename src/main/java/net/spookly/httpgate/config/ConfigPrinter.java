package net.spookly.httpgate.config;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(HttpgateConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object admin = data.get("admin");
        if (admin instanceof Map) {
            Map<String, Object> adminMap = (Map<String, Object>) admin;
            if (adminMap.get("token") != null) {
                adminMap.put("token", REDACTED);
            }
        }
    }
}
