package net.spookly.rtctoken.usage;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory usage store; contents are lost on restart.
 */
public final class InMemoryUsageStore implements UsageStore {
    private final Map<UsageKey, DailyUsage> rows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryUsageStore() {
        this(Clock.systemUTC());
    }

    public InMemoryUsageStore(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public void save(UsageReport report) {
        Objects.requireNonNull(report, "report");
        LocalDate today = LocalDate.now(clock);
        rows.compute(new UsageKey(report.uid(), today), (key, existing) -> {
            DailyUsage base = existing != null ? existing : new DailyUsage(today, 0, 0, 0, null);
            return base.merge(report);
        });
    }

    @Override
    public List<DailyUsage> recent(String uid) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(RECENT_DAYS);
        List<DailyUsage> result = new ArrayList<>();
        for (Map.Entry<UsageKey, DailyUsage> entry : rows.entrySet()) {
            UsageKey key = entry.getKey();
            if (key.uid().equals(uid) && !key.date().isBefore(cutoff)) {
                result.add(entry.getValue());
            }
        }
        result.sort(Comparator.comparing(DailyUsage::date).reversed());
        return result;
    }

    private record UsageKey(String uid, LocalDate date) {
    }
}
