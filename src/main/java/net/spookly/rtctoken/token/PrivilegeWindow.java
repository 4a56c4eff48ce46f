package net.spookly.rtctoken.token;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Issue and expiry instants of a token, in unix seconds.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class PrivilegeWindow {
    private final long issuedAt;
    private final long expiresAt;

    public long ttlSeconds() {
        return expiresAt - issuedAt;
    }
}
