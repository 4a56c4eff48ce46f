package net.spookly.rtctoken.usage;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * PostgreSQL-backed usage store.
 *
 * Schema:
 * CREATE TABLE usage_stats (
 *   firebase_uid    TEXT NOT NULL,
 *   date            DATE NOT NULL,
 *   total_call_time BIGINT NOT NULL DEFAULT 0,
 *   call_count      BIGINT NOT NULL DEFAULT 0,
 *   screen_time     BIGINT NOT NULL DEFAULT 0,
 *   last_location   TEXT,
 *   PRIMARY KEY (firebase_uid, date)
 * );
 */
public final class JdbcUsageStore implements UsageStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcUsageStore.class);

    static final String UPSERT_SQL = """
            INSERT INTO usage_stats
              (firebase_uid, date, total_call_time, call_count, screen_time, last_location)
            VALUES (?, CURRENT_DATE, ?, ?, ?, ?)
            ON CONFLICT (firebase_uid, date)
            DO UPDATE SET
              total_call_time = usage_stats.total_call_time + EXCLUDED.total_call_time,
              call_count      = usage_stats.call_count      + EXCLUDED.call_count,
              screen_time     = usage_stats.screen_time     + EXCLUDED.screen_time,
              last_location   = EXCLUDED.last_location
            """;

    static final String RECENT_SQL = """
            SELECT date, total_call_time, call_count, screen_time, last_location
            FROM usage_stats
            WHERE firebase_uid = ?
              AND date >= CURRENT_DATE - ?
            ORDER BY date DESC
            """;

    private static final RowMapper<DailyUsage> ROW_MAPPER = (rs, rowNum) -> new DailyUsage(
            rs.getDate("date").toLocalDate(),
            rs.getLong("total_call_time"),
            rs.getLong("call_count"),
            rs.getLong("screen_time"),
            rs.getString("last_location")
    );

    private final DataSource dataSource;
    private final JdbcTemplate jdbc;

    /**
     * @param dataSource owned by the store; closed with it when it is {@link Closeable}
     */
    public JdbcUsageStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.jdbc = new JdbcTemplate(dataSource);
    }

    @Override
    public void save(UsageReport report) {
        Objects.requireNonNull(report, "report");
        try {
            jdbc.update(
                    UPSERT_SQL,
                    report.uid(),
                    report.callTime(),
                    report.callCount(),
                    report.screenTime(),
                    report.location()
            );
        } catch (DataAccessException e) {
            throw new UsageStoreException("Failed to save usage for uid " + report.uid(), e);
        }
    }

    @Override
    public List<DailyUsage> recent(String uid) {
        try {
            return jdbc.query(RECENT_SQL, ROW_MAPPER, uid, RECENT_DAYS);
        } catch (DataAccessException e) {
            throw new UsageStoreException("Failed to read usage for uid " + uid, e);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                LOGGER.warn("Failed to close usage store data source", e);
            }
        }
    }
}
