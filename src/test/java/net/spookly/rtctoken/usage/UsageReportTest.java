package net.spookly.rtctoken.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UsageReportTest {
    @Test
    void defaultsMissingCountersToZero() {
        UsageRequests.SaveRequest request = new UsageRequests.SaveRequest();
        request.uid = "user-1";
        request.callCount = 2L;

        UsageReport report = UsageReport.from(request);

        assertEquals("user-1", report.uid());
        assertEquals(0, report.callTime());
        assertEquals(2, report.callCount());
        assertEquals(0, report.screenTime());
        assertNull(report.location());
    }

    @Test
    void requiresUid() {
        UsageRequests.SaveRequest request = new UsageRequests.SaveRequest();
        request.uid = " ";

        assertThrows(IllegalArgumentException.class, () -> UsageReport.from(request));
        assertThrows(IllegalArgumentException.class, () -> UsageReport.from(null));
    }
}
