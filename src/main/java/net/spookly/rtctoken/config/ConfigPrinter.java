package net.spookly.rtctoken.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

import java.util.Map;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    public static String toYaml(RtcTokenConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        Yaml yaml = new Yaml();
        return yaml.dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object credentials = data.get("credentials");
        if (credentials instanceof Map) {
            Map<String, Object> credentialsMap = (Map<String, Object>) credentials;
            if (credentialsMap.get("appCertificate") != null) {
                credentialsMap.put("appCertificate", REDACTED);
            }
        }
        Object usage = data.get("usage");
        if (usage instanceof Map) {
            Map<String, Object> usageMap = (Map<String, Object>) usage;
            if (usageMap.get("password") != null) {
                usageMap.put("password", REDACTED);
            }
        }
    }
}
