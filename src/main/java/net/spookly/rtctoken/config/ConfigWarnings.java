package net.spookly.rtctoken.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects non-fatal configuration warnings (for example, missing signing credentials).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(RtcTokenConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        RtcTokenConfig.CredentialsConfig credentials = config.credentials;
        if (credentials == null || isBlank(credentials.appId)) {
            warnings.add("credentials.appId is not set; token requests will fail");
        }
        if (credentials == null || isBlank(credentials.appCertificate)) {
            warnings.add("credentials.appCertificate is not set; token requests will fail");
        }
        if (config.tokens == null || config.tokens.maxTtlSeconds == null) {
            warnings.add("tokens.maxTtlSeconds is not set; requested token lifetimes are unbounded");
        }
        RtcTokenConfig.UsageConfig usage = config.usage;
        if (usage != null && "jdbc".equalsIgnoreCase(usage.store) && isBlank(usage.password)) {
            warnings.add("usage.password is not set for the jdbc store");
        }
        return warnings;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
