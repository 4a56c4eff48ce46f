package net.spookly.rtctoken.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.spookly.rtctoken.config.RtcTokenConfig;
import org.junit.jupiter.api.Test;

class SigningCredentialTest {
    @Test
    void buildsFromCompleteConfig() {
        RtcTokenConfig config = new RtcTokenConfig();
        config.credentials = new RtcTokenConfig.CredentialsConfig();
        config.credentials.appId = "app-id";
        config.credentials.appCertificate = "secret-cert";

        SigningCredential credential = SigningCredential.fromConfig(config);

        assertNotNull(credential);
        assertEquals("app-id", credential.appId());
        assertEquals("secret-cert", credential.appCertificate());
        assertFalse(credential.toString().contains("secret-cert"));
    }

    @Test
    void isAbsentWhenEitherValueIsMissing() {
        RtcTokenConfig config = new RtcTokenConfig();
        assertNull(SigningCredential.fromConfig(config));

        config.credentials = new RtcTokenConfig.CredentialsConfig();
        config.credentials.appId = "app-id";
        config.credentials.appCertificate = "  ";
        assertNull(SigningCredential.fromConfig(config));
    }

    @Test
    void rejectsBlankValues() {
        assertThrows(IllegalArgumentException.class, () -> SigningCredential.of("", "cert"));
        assertThrows(IllegalArgumentException.class, () -> SigningCredential.of("app", null));
    }
}
