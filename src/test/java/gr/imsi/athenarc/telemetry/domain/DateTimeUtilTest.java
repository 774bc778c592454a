package gr.imsi.athenarc.telemetry.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class DateTimeUtilTest {

    @Test
    public void testRfc3339HasMillisAndZulu() {
        assertEquals("2024-01-01T10:00:00.000Z", DateTimeUtil.formatRfc3339(Instant.parse("2024-01-01T10:00:00Z")));
        assertEquals("2024-01-01T10:00:00.123Z", DateTimeUtil.formatRfc3339(Instant.parse("2024-01-01T10:00:00.123456Z")));
    }

    @Test
    public void testLenientParsing() {
        Instant expected = Instant.parse("2024-01-01T10:00:00Z");
        assertEquals(expected, DateTimeUtil.parseInstant("2024-01-01T10:00:00Z"));
        assertEquals(expected, DateTimeUtil.parseInstant("2024-01-01T12:00:00+02:00"));
        assertEquals(expected, DateTimeUtil.parseInstant("2024-01-01T10:00:00"));
        assertEquals(expected, DateTimeUtil.parseInstant("2024-01-01 10:00:00"));
        assertEquals(expected.plusMillis(250), DateTimeUtil.parseInstant("2024-01-01 10:00:00.250"));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), DateTimeUtil.parseInstant("2024-01-01"));
    }

    @Test
    public void testUnparseableGivesNullOrNow() {
        assertNull(DateTimeUtil.parseInstant("yesterday"));
        assertNull(DateTimeUtil.parseInstant("  "));
        assertNull(DateTimeUtil.parseInstant(null));
        Instant now = DateTimeUtil.parseInstantOrNow("garbage");
        assertTrue(Duration.between(now, Instant.now()).abs().getSeconds() < 5);
    }
}
