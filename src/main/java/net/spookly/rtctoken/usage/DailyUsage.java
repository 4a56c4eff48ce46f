package net.spookly.rtctoken.usage;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Accumulated usage of one user on one day.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class DailyUsage {
    private final LocalDate date;
    private final long totalCallTime;
    private final long callCount;
    private final long screenTime;
    private final String lastLocation;

    /**
     * Add a report's counters; the report's location replaces the stored one.
     */
    DailyUsage merge(UsageReport report) {
        return new DailyUsage(
                date,
                totalCallTime + report.callTime(),
                callCount + report.callCount(),
                screenTime + report.screenTime(),
                report.location()
        );
    }
}
