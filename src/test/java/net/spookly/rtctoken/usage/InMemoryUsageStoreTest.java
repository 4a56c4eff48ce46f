package net.spookly.rtctoken.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

class InMemoryUsageStoreTest {
    private static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

    @Test
    void accumulatesCountersForSameDay() {
        InMemoryUsageStore store = new InMemoryUsageStore(Clock.fixed(START, ZoneOffset.UTC));

        store.save(new UsageReport("user-1", 60, 1, 300, "Berlin"));
        store.save(new UsageReport("user-1", 30, 2, 100, "Hamburg"));

        List<DailyUsage> rows = store.recent("user-1");
        assertEquals(1, rows.size());
        assertEquals(new DailyUsage(LocalDate.of(2026, 10, 19), 90, 3, 400, "Hamburg"), rows.get(0));
    }

    @Test
    void nullLocationReplacesPreviousLocation() {
        InMemoryUsageStore store = new InMemoryUsageStore(Clock.fixed(START, ZoneOffset.UTC));

        store.save(new UsageReport("user-1", 10, 1, 0, "Berlin"));
        store.save(new UsageReport("user-1", 0, 0, 0, null));

        assertEquals(null, store.recent("user-1").get(0).lastLocation());
    }

    @Test
    void returnsLastSevenDaysNewestFirst() {
        MutableClock clock = new MutableClock(START.minus(Duration.ofDays(9)));
        InMemoryUsageStore store = new InMemoryUsageStore(clock);
        for (int day = 0; day < 10; day++) {
            store.save(new UsageReport("user-1", day, 1, 0, null));
            clock.advance(Duration.ofDays(1));
        }
        clock.set(START);

        List<DailyUsage> rows = store.recent("user-1");

        assertEquals(8, rows.size());
        assertEquals(LocalDate.of(2026, 10, 19), rows.get(0).date());
        assertEquals(LocalDate.of(2026, 10, 12), rows.get(7).date());
        assertEquals(9, rows.get(0).totalCallTime());
    }

    @Test
    void keepsUsersSeparate() {
        InMemoryUsageStore store = new InMemoryUsageStore(Clock.fixed(START, ZoneOffset.UTC));

        store.save(new UsageReport("user-1", 10, 1, 0, null));
        store.save(new UsageReport("user-2", 20, 1, 0, null));

        assertEquals(10, store.recent("user-1").get(0).totalCallTime());
        assertEquals(20, store.recent("user-2").get(0).totalCallTime());
        assertTrue(store.recent("user-3").isEmpty());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        void set(Instant instant) {
            now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
