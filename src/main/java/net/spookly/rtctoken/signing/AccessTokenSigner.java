package net.spookly.rtctoken.signing;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.function.LongSupplier;

import net.spookly.rtctoken.token.Role;
import net.spookly.rtctoken.token.Signer;
import net.spookly.rtctoken.token.SigningCredential;

/**
 * {@link Signer} producing version 006 access tokens.
 */
public final class AccessTokenSigner implements Signer {
    /**
     * Lifetime of the signed message itself; privileges carry their own expiry.
     */
    static final long MESSAGE_TTL_SECONDS = 24 * 60 * 60;

    private final Clock clock;
    private final LongSupplier saltSource;

    public AccessTokenSigner() {
        this(Clock.systemUTC(), new SecureSaltSource());
    }

    AccessTokenSigner(Clock clock, LongSupplier saltSource) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.saltSource = saltSource == null ? new SecureSaltSource() : saltSource;
    }

    /**
     * Path uids arrive as text and are signed verbatim, {@code "0"} included.
     */
    @Override
    public String signByUid(SigningCredential credential, String channelName, String uid, Role role, long expiresAt) {
        return signByAccount(credential, channelName, uid, role, expiresAt);
    }

    @Override
    public String signByAccount(SigningCredential credential, String channelName, String account, Role role, long expiresAt) {
        AccessToken token = newToken(credential, channelName, account);
        token.addPrivilege(Privilege.JOIN_CHANNEL, expiresAt);
        if (role == Role.PUBLISHER) {
            token.addPrivilege(Privilege.PUBLISH_AUDIO_STREAM, expiresAt);
            token.addPrivilege(Privilege.PUBLISH_VIDEO_STREAM, expiresAt);
            token.addPrivilege(Privilege.PUBLISH_DATA_STREAM, expiresAt);
        }
        return token.build();
    }

    /**
     * Messaging tokens bind the account in the channel slot and leave the uid empty.
     */
    @Override
    public String signMessaging(SigningCredential credential, String subjectId, Role role, long expiresAt) {
        AccessToken token = newToken(credential, subjectId, "");
        token.addPrivilege(Privilege.RTM_LOGIN, expiresAt);
        return token.build();
    }

    private AccessToken newToken(SigningCredential credential, String channelName, String uid) {
        Objects.requireNonNull(credential, "credential");
        long messageTimestamp = clock.instant().getEpochSecond() + MESSAGE_TTL_SECONDS;
        return new AccessToken(
                credential.appId(),
                credential.appCertificate(),
                channelName,
                uid,
                saltSource.getAsLong(),
                messageTimestamp
        );
    }

    private static final class SecureSaltSource implements LongSupplier {
        private final SecureRandom random = new SecureRandom();

        @Override
        public long getAsLong() {
            return Integer.toUnsignedLong(random.nextInt());
        }
    }
}
