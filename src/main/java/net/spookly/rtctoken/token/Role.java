package net.spookly.rtctoken.token;

/**
 * Privilege level embedded into an issued token.
 */
public enum Role {
    /**
     * Join a channel and publish audio, video and data streams.
     */
    PUBLISHER,
    /**
     * Join a channel and receive streams only.
     */
    SUBSCRIBER,
    /**
     * Log in to the messaging service.
     */
    MESSAGING_USER
}
