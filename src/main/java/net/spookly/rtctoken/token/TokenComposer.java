package net.spookly.rtctoken.token;

import java.util.Objects;

import net.spookly.rtctoken.config.RtcTokenConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates token requests and signs media, messaging and combined tokens.
 * <p>
 * Inputs are checked in a fixed order (channel, subject, role, token type) and the first
 * violation wins. No signer call is made unless every check for the request passed.
 */
public final class TokenComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TokenComposer.class);

    private final SigningCredential credential;
    private final Signer signer;
    private final PrivilegeClock privilegeClock;

    /**
     * @param credential signing credential, or {@code null} when none is configured
     */
    public TokenComposer(SigningCredential credential, Signer signer, PrivilegeClock privilegeClock) {
        this.credential = credential;
        this.signer = Objects.requireNonNull(signer, "signer");
        this.privilegeClock = Objects.requireNonNull(privilegeClock, "privilegeClock");
    }

    public static TokenComposer fromConfig(RtcTokenConfig config, Signer signer, PrivilegeClock privilegeClock) {
        return new TokenComposer(SigningCredential.fromConfig(config), signer, privilegeClock);
    }

    /**
     * Sign a channel token for a uid or account, depending on the request's token type.
     */
    public TokenResult<TokenArtifact> composeMediaToken(TokenRequest request) {
        Objects.requireNonNull(request, "request");
        TokenResult<String> channel = IdentityValidator.validateChannel(request.channelName());
        if (!channel.ok()) {
            return channel.propagate();
        }
        TokenResult<String> subject = IdentityValidator.validateSubject(request.subjectId());
        if (!subject.ok()) {
            return subject.propagate();
        }
        TokenResult<Role> role = RoleResolver.resolve(request.role(), TokenPurpose.MEDIA);
        if (!role.ok()) {
            return role.propagate();
        }
        TokenResult<TokenType> tokenType = TokenType.fromSelector(request.tokenType());
        if (!tokenType.ok()) {
            return tokenType.propagate();
        }
        PrivilegeWindow window = privilegeClock.computeExpiry(request.requestedTtl());
        if (credential == null) {
            return missingCredential();
        }

        String token;
        if (tokenType.value() == TokenType.USER_ACCOUNT) {
            token = signer.signByAccount(credential, channel.value(), subject.value(), role.value(), window.expiresAt());
        } else {
            token = signer.signByUid(credential, channel.value(), subject.value(), role.value(), window.expiresAt());
        }
        LOGGER.debug("Issued media token channel={} subject={} role={} type={} expiresAt={} token={}",
                channel.value(), subject.value(), role.value(), tokenType.value(), window.expiresAt(),
                TokenRedactor.redact(token));
        return TokenResult.ok(new TokenArtifact(token, window));
    }

    /**
     * Sign a messaging login token. The role is fixed, so only the subject is validated.
     */
    public TokenResult<TokenArtifact> composeMessagingToken(TokenRequest request) {
        Objects.requireNonNull(request, "request");
        TokenResult<String> subject = IdentityValidator.validateSubject(request.subjectId());
        if (!subject.ok()) {
            return subject.propagate();
        }
        Role role = RoleResolver.resolve(request.role(), TokenPurpose.MESSAGING).value();
        PrivilegeWindow window = privilegeClock.computeExpiry(request.requestedTtl());
        if (credential == null) {
            return missingCredential();
        }

        String token = signer.signMessaging(credential, subject.value(), role, window.expiresAt());
        LOGGER.debug("Issued messaging token subject={} expiresAt={} token={}",
                subject.value(), window.expiresAt(), TokenRedactor.redact(token));
        return TokenResult.ok(new TokenArtifact(token, window));
    }

    /**
     * Sign a uid channel token and a messaging token sharing one privilege window.
     * Both are signed only after all inputs are valid; the token type selector is ignored.
     */
    public TokenResult<CombinedTokenArtifact> composeCombinedToken(TokenRequest request) {
        Objects.requireNonNull(request, "request");
        TokenResult<String> channel = IdentityValidator.validateChannel(request.channelName());
        if (!channel.ok()) {
            return channel.propagate();
        }
        TokenResult<String> subject = IdentityValidator.validateSubject(request.subjectId());
        if (!subject.ok()) {
            return subject.propagate();
        }
        TokenResult<Role> mediaRole = RoleResolver.resolve(request.role(), TokenPurpose.MEDIA);
        if (!mediaRole.ok()) {
            return mediaRole.propagate();
        }
        Role messagingRole = RoleResolver.resolve(request.role(), TokenPurpose.MESSAGING).value();
        PrivilegeWindow window = privilegeClock.computeExpiry(request.requestedTtl());
        if (credential == null) {
            return missingCredential();
        }

        String rtcToken = signer.signByUid(credential, channel.value(), subject.value(), mediaRole.value(), window.expiresAt());
        String rtmToken = signer.signMessaging(credential, subject.value(), messagingRole, window.expiresAt());
        LOGGER.debug("Issued combined tokens channel={} subject={} role={} expiresAt={} rtcToken={} rtmToken={}",
                channel.value(), subject.value(), mediaRole.value(), window.expiresAt(),
                TokenRedactor.redact(rtcToken), TokenRedactor.redact(rtmToken));
        return TokenResult.ok(new CombinedTokenArtifact(
                new TokenArtifact(rtcToken, window),
                new TokenArtifact(rtmToken, window)
        ));
    }

    private <T> TokenResult<T> missingCredential() {
        LOGGER.error("Token request rejected: signing credentials are not configured");
        return TokenResult.error(TokenError.MISSING_CREDENTIAL);
    }
}
