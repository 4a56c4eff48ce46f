package net.spookly.rtctoken.token;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.rtctoken.config.RtcTokenConfig;

/**
 * Process-wide app id and certificate used to sign every token.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SigningCredential {
    private final String appId;
    private final String appCertificate;

    public static SigningCredential of(String appId, String appCertificate) {
        if (isBlank(appId)) {
            throw new IllegalArgumentException("appId is required");
        }
        if (isBlank(appCertificate)) {
            throw new IllegalArgumentException("appCertificate is required");
        }
        return new SigningCredential(appId.trim(), appCertificate.trim());
    }

    /**
     * Credential from config, or {@code null} when either value is missing.
     */
    public static SigningCredential fromConfig(RtcTokenConfig config) {
        if (config == null || config.credentials == null) {
            return null;
        }
        if (isBlank(config.credentials.appId) || isBlank(config.credentials.appCertificate)) {
            return null;
        }
        return of(config.credentials.appId, config.credentials.appCertificate);
    }

    @Override
    public String toString() {
        return "SigningCredential{appId=" + appId + ", appCertificate=" + TokenRedactor.redact(appCertificate) + "}";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
