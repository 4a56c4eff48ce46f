package net.spookly.rtctoken.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default rtctoken config.
            # Credentials are read from APP_ID and APP_CERTIFICATE. Without them every
            # token request fails with a server-side configuration error.
            server:
              host: 0.0.0.0
              port: env?:PORT
              workerThreads: 4
              maxRequestBytes: 65536
              corsAllowOrigin: "*"

            credentials:
              appId: env?:APP_ID
              appCertificate: env?:APP_CERTIFICATE

            tokens:
              defaultTtlSeconds: 3600

            usage:
              store: memory

            logging:
              level: INFO
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
