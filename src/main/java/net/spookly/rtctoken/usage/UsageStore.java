package net.spookly.rtctoken.usage;

import java.util.List;

/**
 * Per-user, per-day usage counters.
 */
public interface UsageStore extends AutoCloseable {
    /**
     * Number of days, counted back from today, returned by {@link #recent(String)}.
     */
    int RECENT_DAYS = 7;

    /**
     * Add the report to the user's row for today, creating it if needed.
     */
    void save(UsageReport report);

    /**
     * Rows for the user from the last {@link #RECENT_DAYS} days, newest first.
     */
    List<DailyUsage> recent(String uid);

    /**
     * Release backing resources.
     */
    @Override
    default void close() {
    }
}
