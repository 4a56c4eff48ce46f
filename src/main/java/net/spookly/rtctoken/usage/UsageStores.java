package net.spookly.rtctoken.usage;

import java.time.Clock;

import com.zaxxer.hikari.HikariDataSource;
import net.spookly.rtctoken.config.RtcTokenConfig;

/**
 * Builds the configured usage store.
 */
public final class UsageStores {
    static final int DEFAULT_POOL_SIZE = 4;

    private UsageStores() {
    }

    public static UsageStore fromConfig(RtcTokenConfig config, Clock clock) {
        RtcTokenConfig.UsageConfig usage = config == null ? null : config.usage;
        if (usage != null && "jdbc".equalsIgnoreCase(usage.store)) {
            return new JdbcUsageStore(dataSource(usage));
        }
        return new InMemoryUsageStore(clock);
    }

    /**
     * Pooled data source; the pool starts on first use.
     */
    static HikariDataSource dataSource(RtcTokenConfig.UsageConfig usage) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("rtctoken-usage");
        dataSource.setJdbcUrl(usage.jdbcUrl);
        dataSource.setUsername(usage.username);
        dataSource.setPassword(usage.password);
        dataSource.setMaximumPoolSize(usage.maxPoolSize != null ? usage.maxPoolSize : DEFAULT_POOL_SIZE);
        return dataSource;
    }
}
