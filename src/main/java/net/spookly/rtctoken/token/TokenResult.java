package net.spookly.rtctoken.token;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Outcome of a validation or composition step: a value, or the error that stopped it.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TokenResult<T> {
    private final boolean ok;
    private final T value;
    private final TokenError error;

    public static <T> TokenResult<T> ok(T value) {
        return new TokenResult<>(true, value, null);
    }

    public static <T> TokenResult<T> error(TokenError error) {
        return new TokenResult<>(false, null, error);
    }

    /**
     * Re-type a failed result so it can be returned from a step producing a different value.
     */
    public <R> TokenResult<R> propagate() {
        if (ok) {
            throw new IllegalStateException("cannot propagate a successful result");
        }
        return error(error);
    }
}
