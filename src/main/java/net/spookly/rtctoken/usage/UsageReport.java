package net.spookly.rtctoken.usage;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Usage increments for one user; added to the user's row for the current day.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class UsageReport {
    private final String uid;
    private final long callTime;
    private final long callCount;
    private final long screenTime;
    private final String location;

    /**
     * Normalize a request payload: absent counters count as zero.
     */
    public static UsageReport from(UsageRequests.SaveRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body required");
        }
        if (request.uid == null || request.uid.trim().isEmpty()) {
            throw new IllegalArgumentException("uid is required");
        }
        return new UsageReport(
                request.uid,
                orZero(request.callTime),
                orZero(request.callCount),
                orZero(request.screenTime),
                request.location
        );
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
