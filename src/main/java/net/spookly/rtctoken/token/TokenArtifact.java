package net.spookly.rtctoken.token;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Opaque signed token handed back to the caller.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class TokenArtifact {
    private final String token;
    private final PrivilegeWindow window;

    @Override
    public String toString() {
        return "TokenArtifact{token=" + TokenRedactor.redact(token) + ", window=" + window + "}";
    }
}
