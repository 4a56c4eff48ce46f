package net.spookly.rtctoken.config;

import java.util.ArrayList;
import java.util.List;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     * Missing credentials are not a violation; they surface as warnings and per-request errors.
     */
    public static void validate(RtcTokenConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateServer(config, errors);
        validateTokens(config, errors);
        validateUsage(config, errors);
        validateLogging(config, errors);

        throwIfErrors(errors);
    }

    private static void validateServer(RtcTokenConfig config, List<String> errors) {
        RtcTokenConfig.ServerConfig server = config.server;
        if (server == null) {
            errors.add("server section is required");
            return;
        }
        requireNonBlank(errors, server.host, "server.host");
        if (server.port != null) {
            requirePort(errors, server.port, "server.port");
        }
        if (server.workerThreads != null) {
            requirePositive(errors, server.workerThreads, "server.workerThreads");
        }
        if (server.maxRequestBytes != null) {
            requirePositive(errors, server.maxRequestBytes, "server.maxRequestBytes");
        }
        if (server.corsAllowOrigin != null && isBlank(server.corsAllowOrigin)) {
            errors.add("server.corsAllowOrigin must not be blank when set");
        }
    }

    private static void validateTokens(RtcTokenConfig config, List<String> errors) {
        RtcTokenConfig.TokensConfig tokens = config.tokens;
        if (tokens == null) {
            return;
        }
        if (tokens.defaultTtlSeconds != null) {
            requirePositive(errors, tokens.defaultTtlSeconds, "tokens.defaultTtlSeconds");
        }
        if (tokens.maxTtlSeconds != null) {
            requirePositive(errors, tokens.maxTtlSeconds, "tokens.maxTtlSeconds");
            int defaultTtl = tokens.defaultTtlSeconds != null ? tokens.defaultTtlSeconds : 3600;
            if (tokens.maxTtlSeconds > 0 && tokens.maxTtlSeconds < defaultTtl) {
                errors.add("tokens.maxTtlSeconds must not be lower than tokens.defaultTtlSeconds");
            }
        }
    }

    private static void validateUsage(RtcTokenConfig config, List<String> errors) {
        RtcTokenConfig.UsageConfig usage = config.usage;
        if (usage == null) {
            return;
        }
        if (!isBlank(usage.store) && !isOneOf(usage.store, "memory", "jdbc")) {
            errors.add("usage.store must be one of: memory, jdbc");
        }
        if (isOneOf(usage.store, "jdbc")) {
            requireNonBlank(errors, usage.jdbcUrl, "usage.jdbcUrl");
        }
        if (usage.maxPoolSize != null) {
            requirePositive(errors, usage.maxPoolSize, "usage.maxPoolSize");
        }
    }

    private static void validateLogging(RtcTokenConfig config, List<String> errors) {
        RtcTokenConfig.LoggingConfig logging = config.logging;
        if (logging == null || isBlank(logging.level)) {
            return;
        }
        if (!isOneOf(logging.level, "trace", "debug", "info", "warn", "error")) {
            errors.add("logging.level must be one of: trace, debug, info, warn, error");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
