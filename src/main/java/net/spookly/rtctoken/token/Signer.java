package net.spookly.rtctoken.token;

/**
 * Produces signed token strings. Implementations are expected to succeed for non-empty
 * inputs and a valid credential; any exception fails only the current request.
 */
public interface Signer {
    String signByUid(SigningCredential credential, String channelName, String uid, Role role, long expiresAt);

    String signByAccount(SigningCredential credential, String channelName, String account, Role role, long expiresAt);

    String signMessaging(SigningCredential credential, String subjectId, Role role, long expiresAt);
}
