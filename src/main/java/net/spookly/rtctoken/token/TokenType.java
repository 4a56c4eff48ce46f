package net.spookly.rtctoken.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * How the subject of a media token is encoded: numeric uid or string account.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TokenType {
    UID("uid"),
    USER_ACCOUNT("userAccount");

    private final String selector;

    /**
     * Parse the external selector; matching is exact.
     */
    public static TokenResult<TokenType> fromSelector(String selector) {
        for (TokenType type : values()) {
            if (type.selector.equals(selector)) {
                return TokenResult.ok(type);
            }
        }
        return TokenResult.error(TokenError.INVALID_TOKEN_TYPE);
    }
}
