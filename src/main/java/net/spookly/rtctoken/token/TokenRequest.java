package net.spookly.rtctoken.token;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raw token request values as received at the boundary.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class TokenRequest {
    private final String channelName;
    private final String subjectId;
    private final String role;
    /**
     * {@code uid} or {@code userAccount}; only read for media tokens.
     */
    private final String tokenType;
    /**
     * Requested lifetime in seconds; absent or non-numeric means the default.
     */
    private final String requestedTtl;

    public static TokenRequest media(String channelName, String subjectId, String role, String tokenType, String requestedTtl) {
        return new TokenRequest(channelName, subjectId, role, tokenType, requestedTtl);
    }

    public static TokenRequest messaging(String subjectId, String requestedTtl) {
        return new TokenRequest(null, subjectId, null, null, requestedTtl);
    }

    public static TokenRequest combined(String channelName, String subjectId, String role, String requestedTtl) {
        return new TokenRequest(channelName, subjectId, role, TokenType.UID.selector(), requestedTtl);
    }
}
