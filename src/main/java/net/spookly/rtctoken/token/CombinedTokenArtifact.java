package net.spookly.rtctoken.token;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Media and messaging tokens issued together for the same subject and window.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class CombinedTokenArtifact {
    private final TokenArtifact rtc;
    private final TokenArtifact rtm;
}
