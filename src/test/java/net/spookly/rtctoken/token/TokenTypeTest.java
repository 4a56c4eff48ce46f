package net.spookly.rtctoken.token;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TokenTypeTest {
    @Test
    void parsesKnownSelectors() {
        assertEquals(TokenType.UID, TokenType.fromSelector("uid").value());
        assertEquals(TokenType.USER_ACCOUNT, TokenType.fromSelector("userAccount").value());
    }

    @Test
    void selectorsAreCaseSensitive() {
        assertEquals(TokenError.INVALID_TOKEN_TYPE, TokenType.fromSelector("UID").error());
        assertEquals(TokenError.INVALID_TOKEN_TYPE, TokenType.fromSelector("useraccount").error());
        assertEquals(TokenError.INVALID_TOKEN_TYPE, TokenType.fromSelector(null).error());
    }
}
