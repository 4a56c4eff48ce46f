package net.spookly.rtctoken.token;

/**
 * Which service a resolved role is meant for.
 */
public enum TokenPurpose {
    MEDIA,
    MESSAGING
}
