package net.spookly.rtctoken.signing;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Privilege keys packed into an access token; each maps to its expiry timestamp.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Privilege {
    JOIN_CHANNEL(1),
    PUBLISH_AUDIO_STREAM(2),
    PUBLISH_VIDEO_STREAM(3),
    PUBLISH_DATA_STREAM(4),
    RTM_LOGIN(1000);

    private final int code;
}
