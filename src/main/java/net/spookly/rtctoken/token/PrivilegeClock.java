package net.spookly.rtctoken.token;

import java.time.Clock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.spookly.rtctoken.config.RtcTokenConfig;

/**
 * Computes privilege windows from the current time and a requested lifetime.
 */
public final class PrivilegeClock {
    public static final int DEFAULT_TTL_SECONDS = 3600;
    /**
     * Largest expiry a token can carry: privilege timestamps are unsigned 32-bit seconds.
     */
    public static final long MAX_EXPIRES_AT = 0xFFFFFFFFL;
    private static final Pattern LEADING_INTEGER = Pattern.compile("\\s*([+-]?\\d+)");

    private final Clock clock;
    private final int defaultTtlSeconds;
    private final Integer maxTtlSeconds;

    public PrivilegeClock() {
        this(Clock.systemUTC(), DEFAULT_TTL_SECONDS, null);
    }

    /**
     * @param maxTtlSeconds optional cap; {@code null} leaves lifetimes unbounded.
     */
    public PrivilegeClock(Clock clock, int defaultTtlSeconds, Integer maxTtlSeconds) {
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be greater than 0");
        }
        if (maxTtlSeconds != null && maxTtlSeconds <= 0) {
            throw new IllegalArgumentException("maxTtlSeconds must be greater than 0");
        }
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.maxTtlSeconds = maxTtlSeconds;
    }

    public static PrivilegeClock fromConfig(RtcTokenConfig config, Clock clock) {
        int defaultTtl = DEFAULT_TTL_SECONDS;
        Integer maxTtl = null;
        if (config != null && config.tokens != null) {
            if (config.tokens.defaultTtlSeconds != null) {
                defaultTtl = config.tokens.defaultTtlSeconds;
            }
            maxTtl = config.tokens.maxTtlSeconds;
        }
        return new PrivilegeClock(clock, defaultTtl, maxTtl);
    }

    /**
     * Window starting now (whole seconds) and lasting the requested or default lifetime.
     * The expiry never passes {@link #MAX_EXPIRES_AT}.
     */
    public PrivilegeWindow computeExpiry(String requestedTtl) {
        long issuedAt = clock.instant().getEpochSecond();
        long ttl = parseTtl(requestedTtl);
        if (maxTtlSeconds != null && ttl > maxTtlSeconds) {
            ttl = maxTtlSeconds;
        }
        long remaining = MAX_EXPIRES_AT - issuedAt;
        if (ttl > remaining) {
            if (remaining <= 0) {
                throw new IllegalStateException("clock is past the last representable expiry");
            }
            ttl = remaining;
        }
        return new PrivilegeWindow(issuedAt, issuedAt + ttl);
    }

    /**
     * Leading integer of the value, like a lenient {@code parseInt}: {@code "12abc"} is 12,
     * {@code "1.5"} is 1. Anything without leading digits, or not positive, is the default.
     */
    private long parseTtl(String raw) {
        if (raw == null) {
            return defaultTtlSeconds;
        }
        Matcher matcher = LEADING_INTEGER.matcher(raw);
        if (!matcher.lookingAt()) {
            return defaultTtlSeconds;
        }
        String digits = matcher.group(1);
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // too many digits for a long; only positive values survive the check below
            value = digits.startsWith("-") ? -1 : Long.MAX_VALUE;
        }
        return value > 0 ? value : defaultTtlSeconds;
    }
}
