package net.spookly.rtctoken;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import net.spookly.rtctoken.config.ConfigException;
import net.spookly.rtctoken.config.ConfigLoader;
import net.spookly.rtctoken.config.ConfigPrinter;
import net.spookly.rtctoken.config.ConfigWarnings;
import net.spookly.rtctoken.config.RtcTokenConfig;
import net.spookly.rtctoken.http.TokenServer;
import net.spookly.rtctoken.signing.AccessTokenSigner;
import net.spookly.rtctoken.token.PrivilegeClock;
import net.spookly.rtctoken.token.TokenComposer;
import net.spookly.rtctoken.usage.UsageStore;
import net.spookly.rtctoken.usage.UsageStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point for the token server process.
 */
public final class RtcTokenMain {
    private static final Logger LOGGER = LoggerFactory.getLogger(RtcTokenMain.class);
    private static final String DEFAULT_CONFIG = "config/rtctoken.yaml";

    private RtcTokenMain() {
    }

    /**
     * Load config, wire the composer and start the HTTP server.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        RtcTokenConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (ConfigException e) {
            LOGGER.error("{}", e.getMessage());
            System.exit(1);
            return;
        }
        applyLogLevel(config);
        for (String warning : ConfigWarnings.collect(config)) {
            LOGGER.warn("Config warning: {}", warning);
        }
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        Clock clock = Clock.systemUTC();
        TokenComposer composer = TokenComposer.fromConfig(
                config,
                new AccessTokenSigner(),
                PrivilegeClock.fromConfig(config, clock)
        );
        UsageStore usageStore = UsageStores.fromConfig(config, clock);
        TokenServer server = new TokenServer(config, composer, usageStore);
        server.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            usageStore.close();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void applyLogLevel(RtcTokenConfig config) {
        if (config.logging == null || config.logging.level == null) {
            return;
        }
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger("net.spookly.rtctoken").setLevel(Level.toLevel(config.logging.level, Level.INFO));
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
