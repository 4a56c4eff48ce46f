package net.spookly.rtctoken.token;

/**
 * Maps external role names onto {@link Role}.
 */
public final class RoleResolver {
    static final String PUBLISHER = "publisher";
    static final String AUDIENCE = "audience";

    private RoleResolver() {
    }

    /**
     * Media roles must be {@code publisher} or {@code audience}; messaging always yields
     * {@link Role#MESSAGING_USER} and never fails.
     */
    public static TokenResult<Role> resolve(String rawRole, TokenPurpose purpose) {
        if (purpose == TokenPurpose.MESSAGING) {
            return TokenResult.ok(Role.MESSAGING_USER);
        }
        if (PUBLISHER.equals(rawRole)) {
            return TokenResult.ok(Role.PUBLISHER);
        }
        if (AUDIENCE.equals(rawRole)) {
            return TokenResult.ok(Role.SUBSCRIBER);
        }
        return TokenResult.error(TokenError.INVALID_ROLE);
    }
}
