package net.spookly.rtctoken.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

import com.zaxxer.hikari.HikariDataSource;
import net.spookly.rtctoken.config.RtcTokenConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JdbcUsageStoreTest {
    private static final String SCHEMA = """
            CREATE TABLE usage_stats (
              firebase_uid    TEXT NOT NULL,
              date            DATE NOT NULL,
              total_call_time BIGINT NOT NULL DEFAULT 0,
              call_count      BIGINT NOT NULL DEFAULT 0,
              screen_time     BIGINT NOT NULL DEFAULT 0,
              last_location   TEXT,
              PRIMARY KEY (firebase_uid, date)
            )
            """;

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private JdbcUsageStore store;
    private JdbcTemplate jdbc;
    private LocalDate today;

    @BeforeEach
    void setUp() {
        RtcTokenConfig.UsageConfig usage = new RtcTokenConfig.UsageConfig();
        usage.store = "jdbc";
        usage.jdbcUrl = POSTGRES.getJdbcUrl();
        usage.username = POSTGRES.getUsername();
        usage.password = POSTGRES.getPassword();
        HikariDataSource dataSource = UsageStores.dataSource(usage);
        jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("DROP TABLE IF EXISTS usage_stats");
        jdbc.execute(SCHEMA);
        today = jdbc.queryForObject("SELECT CURRENT_DATE", Date.class).toLocalDate();
        store = new JdbcUsageStore(dataSource);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void accumulatesCountersForSameDay() {
        store.save(new UsageReport("user-1", 60, 1, 300, "Berlin"));
        store.save(new UsageReport("user-1", 30, 2, 100, "Hamburg"));

        List<DailyUsage> rows = store.recent("user-1");

        assertEquals(List.of(new DailyUsage(today, 90, 3, 400, "Hamburg")), rows);
    }

    @Test
    void missingLocationClearsStoredLocation() {
        store.save(new UsageReport("user-1", 10, 1, 0, "Berlin"));
        store.save(new UsageReport("user-1", 0, 0, 0, null));

        assertNull(store.recent("user-1").get(0).lastLocation());
    }

    @Test
    void returnsLastSevenDaysNewestFirst() {
        for (int daysAgo = 0; daysAgo <= 9; daysAgo++) {
            jdbc.update(
                    "INSERT INTO usage_stats (firebase_uid, date, total_call_time) VALUES (?, ?, ?)",
                    "user-1", Date.valueOf(today.minusDays(daysAgo)), daysAgo);
        }
        jdbc.update("INSERT INTO usage_stats (firebase_uid, date) VALUES (?, ?)", "user-2", Date.valueOf(today));

        List<DailyUsage> rows = store.recent("user-1");

        assertEquals(8, rows.size());
        assertEquals(today, rows.get(0).date());
        assertEquals(today.minusDays(7), rows.get(7).date());
        for (int i = 1; i < rows.size(); i++) {
            assertTrue(rows.get(i - 1).date().isAfter(rows.get(i).date()));
        }
    }

    @Test
    void wrapsDatabaseFailures() {
        jdbc.execute("DROP TABLE usage_stats");

        assertThrows(UsageStoreException.class, () -> store.save(new UsageReport("user-1", 1, 1, 1, null)));
        assertThrows(UsageStoreException.class, () -> store.recent("user-1"));
    }
}
