package net.spookly.rtctoken.token;

/**
 * Presence checks for channel and subject identifiers. Encoding rules belong to the signer.
 */
public final class IdentityValidator {
    private IdentityValidator() {
    }

    public static TokenResult<String> validateChannel(String channelName) {
        if (channelName == null || channelName.isEmpty()) {
            return TokenResult.error(TokenError.MISSING_CHANNEL);
        }
        return TokenResult.ok(channelName);
    }

    public static TokenResult<String> validateSubject(String subjectId) {
        if (subjectId == null || subjectId.isEmpty()) {
            return TokenResult.error(TokenError.MISSING_SUBJECT);
        }
        return TokenResult.ok(subjectId);
    }
}
