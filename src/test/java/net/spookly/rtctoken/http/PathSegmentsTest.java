package net.spookly.rtctoken.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.net.URI;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class PathSegmentsTest {
    @Test
    void splitsAndDecodesSegments() {
        List<String> segments = TokenServer.pathSegments(URI.create("/rtc/my%20room/publisher/uid/a+b"), "/rtc/", 4);

        assertEquals(List.of("my room", "publisher", "uid", "a+b"), segments);
    }

    @Test
    void toleratesSingleTrailingSlash() {
        assertEquals(List.of("alice"), TokenServer.pathSegments(URI.create("/rtm/alice/"), "/rtm/", 1));
        assertNull(TokenServer.pathSegments(URI.create("/rtm/alice//"), "/rtm/", 1));
    }

    @Test
    void rejectsWrongSegmentCount() {
        assertNull(TokenServer.pathSegments(URI.create("/rtc/room/publisher/uid"), "/rtc/", 4));
        assertNull(TokenServer.pathSegments(URI.create("/rtc/room/publisher/uid/1/2"), "/rtc/", 4));
        assertNull(TokenServer.pathSegments(URI.create("/other/alice"), "/rtm/", 1));
    }

    @Test
    void keepsFirstQueryValue() {
        Map<String, String> params = TokenServer.parseQueryParams(URI.create("/rtm/alice?expiry=60&expiry=90&flag"));

        assertEquals("60", params.get("expiry"));
        assertEquals("", params.get("flag"));
    }

    @Test
    void emptyQueryYieldsNoParams() {
        assertEquals(Map.of(), TokenServer.parseQueryParams(URI.create("/ping")));
    }
}
