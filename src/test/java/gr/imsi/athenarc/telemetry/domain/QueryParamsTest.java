package gr.imsi.athenarc.telemetry.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class QueryParamsTest {

    @Test
    public void testDefaultsCoverTheLastDayWithLimit() {
        QueryParams params = QueryParams.builder().build();
        assertEquals(Duration.ofDays(1), Duration.between(params.getStartTime(), params.getEndTime()));
        assertEquals(QueryParams.DEFAULT_LIMIT, params.getLimit());
        assertTrue(params.hasValidTimeRange());
        assertNull(params.getCollectorId());
    }

    @Test
    public void testNullLimitMeansUnlimited() {
        QueryParams params = QueryParams.builder().limit(null).build();
        assertNull(params.getLimit());
    }

    @Test
    public void testNonPositiveLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> QueryParams.builder().limit(0).build());
        assertThrows(IllegalArgumentException.class, () -> QueryParams.builder().limit(-5).build());
    }

    @Test
    public void testTimeRangeMustBeIncreasing() {
        Instant t = Instant.parse("2024-01-01T10:00:00Z");
        assertFalse(QueryParams.builder().startTime(t).endTime(t).build().hasValidTimeRange());
        assertFalse(QueryParams.builder().startTime(t.plusSeconds(1)).endTime(t).build().hasValidTimeRange());
        assertTrue(QueryParams.builder().startTime(t).endTime(t.plusMillis(1)).build().hasValidTimeRange());
    }

    @Test
    public void testFiltersByLevel() {
        QueryParams params = QueryParams.builder()
            .filter(HierarchyLevel.COLLECTOR, "1")
            .filter(HierarchyLevel.GATEWAY, "2")
            .filter(HierarchyLevel.EQUIPMENT, "3")
            .filter(HierarchyLevel.TAG, "4,5")
            .build();
        assertEquals("1", params.getFilter(HierarchyLevel.COLLECTOR));
        assertEquals("2", params.getGatewayId());
        assertEquals("3", params.getFilter(HierarchyLevel.EQUIPMENT));
        assertEquals("4,5", params.getTagId());
    }

    @Test
    public void testToBuilderCopiesEverything() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-02T00:00:00Z");
        QueryParams original = QueryParams.builder()
            .collectorId("10").gatewayId("20").equipmentId("30").tagId("40")
            .startTime(start).endTime(end).limit(50)
            .build();
        QueryParams copy = original.toBuilder().gatewayId(null).build();
        assertEquals("10", copy.getCollectorId());
        assertNull(copy.getGatewayId());
        assertEquals("30", copy.getEquipmentId());
        assertEquals("40", copy.getTagId());
        assertEquals(start, copy.getStartTime());
        assertEquals(end, copy.getEndTime());
        assertEquals(50, copy.getLimit());
        assertEquals("20", original.getGatewayId());
    }
}
