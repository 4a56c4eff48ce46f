package net.spookly.rtctoken.usage;

/**
 * Request payloads for usage API endpoints.
 */
public final class UsageRequests {
    /**
     * Usage counters reported by a client for the current day.
     */
    public static final class SaveRequest {
        public String uid;
        public Long callTime;
        public Long callCount;
        public Long screenTime;
        public String location;
    }

    private UsageRequests() {
    }
}
