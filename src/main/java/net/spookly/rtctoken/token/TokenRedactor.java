package net.spookly.rtctoken.token;

/**
 * Log-safe rendering of signed tokens and certificates.
 * <p>
 * An access token keeps its version prefix so log lines still show which format was issued;
 * everything after it, and any other secret, is reduced to its length.
 */
public final class TokenRedactor {
    private static final String TOKEN_VERSION = "006";

    private TokenRedactor() {
    }

    public static String redact(String secret) {
        if (secret == null || secret.isEmpty()) {
            return secret;
        }
        if (secret.length() > TOKEN_VERSION.length() && secret.startsWith(TOKEN_VERSION)) {
            return TOKEN_VERSION + "<redacted:" + (secret.length() - TOKEN_VERSION.length()) + ">";
        }
        return "<redacted:" + secret.length() + ">";
    }
}
