package net.spookly.rtctoken.token;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class TokenRedactorTest {
    @Test
    void nullAndEmptyPassThrough() {
        assertNull(TokenRedactor.redact(null));
        assertEquals("", TokenRedactor.redact(""));
    }

    @Test
    void accessTokenKeepsOnlyVersionPrefix() {
        assertEquals("006<redacted:9>", TokenRedactor.redact("006appIdXYZ"));
    }

    @Test
    void otherSecretsShowOnlyLength() {
        assertEquals("<redacted:11>", TokenRedactor.redact("secret-cert"));
        assertEquals("<redacted:3>", TokenRedactor.redact("006"));
    }

    @Test
    void artifactToStringHidesToken() {
        TokenArtifact artifact = new TokenArtifact("006secret", new PrivilegeWindow(1, 2));
        assertFalse(artifact.toString().contains("secret"));
    }
}
