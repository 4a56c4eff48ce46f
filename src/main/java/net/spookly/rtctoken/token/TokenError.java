package net.spookly.rtctoken.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Reasons a token cannot be composed.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TokenError {
    MISSING_CHANNEL("channel is required", true),
    MISSING_SUBJECT("uid is required", true),
    INVALID_ROLE("role is incorrect", true),
    INVALID_TOKEN_TYPE("token type is invalid", true),
    /**
     * Operator misconfiguration; not caused by the request.
     */
    MISSING_CREDENTIAL("APP_ID or APP_CERTIFICATE missing", false);

    private final String message;
    private final boolean clientError;
}
