package net.spookly.rtctoken.config;

public class RtcTokenConfig {
    public ServerConfig server;
    public CredentialsConfig credentials;
    public TokensConfig tokens;
    public UsageConfig usage;
    public LoggingConfig logging;

    public static class ServerConfig {
        public String host;
        public Integer port;
        public Integer workerThreads;
        public Integer maxRequestBytes;
        public String corsAllowOrigin;
    }

    public static class CredentialsConfig {
        public String appId;
        /**
         * Shared secret used as the HMAC key. Never printed or logged.
         */
        public String appCertificate;
    }

    public static class TokensConfig {
        public Integer defaultTtlSeconds;
        /**
         * Optional upper bound for requested lifetimes. Unset means unbounded.
         */
        public Integer maxTtlSeconds;
    }

    public static class UsageConfig {
        public String store;
        public String jdbcUrl;
        public String username;
        public String password;
        public Integer maxPoolSize;
    }

    public static class LoggingConfig {
        public String level;
    }
}
