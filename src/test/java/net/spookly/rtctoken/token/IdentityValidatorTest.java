package net.spookly.rtctoken.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IdentityValidatorTest {
    @Test
    void requiresChannel() {
        assertEquals(TokenError.MISSING_CHANNEL, IdentityValidator.validateChannel(null).error());
        assertEquals(TokenError.MISSING_CHANNEL, IdentityValidator.validateChannel("").error());
    }

    @Test
    void requiresSubject() {
        assertEquals(TokenError.MISSING_SUBJECT, IdentityValidator.validateSubject(null).error());
        assertEquals(TokenError.MISSING_SUBJECT, IdentityValidator.validateSubject("").error());
    }

    @Test
    void acceptsAnyNonEmptyValue() {
        TokenResult<String> channel = IdentityValidator.validateChannel(" room with spaces/ü ");
        assertTrue(channel.ok());
        assertEquals(" room with spaces/ü ", channel.value());
        assertEquals("0", IdentityValidator.validateSubject("0").value());
    }
}
