package gr.imsi.athenarc.telemetry.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class DataPointTest {

    private static final Instant T = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    public void testNullFieldsBecomeEmpty() {
        DataPoint point = new DataPoint(T, null, null, null, null, null);
        assertEquals("", point.getCollectorId());
        assertEquals("", point.getGatewayId());
        assertEquals("", point.getEquipmentId());
        assertEquals("", point.getTagId());
        assertEquals("", point.getValue());
        assertNull(point.getAggregationKind());
    }

    @Test
    public void testNumericValue() {
        assertEquals(12.5, new DataPoint(T, "1", "2", "3", "4", " 12.5 ").numericValue().getAsDouble(), 1e-9);
        assertTrue(new DataPoint(T, "1", "2", "3", "4", "n/a").numericValue().isEmpty());
        assertTrue(new DataPoint(T, "1", "2", "3", "4", "").numericValue().isEmpty());
    }

    @Test
    public void testIdByLevel() {
        DataPoint point = new DataPoint(T, "c", "g", "e", "t", "1");
        assertEquals("c", point.getId(HierarchyLevel.COLLECTOR));
        assertEquals("g", point.getId(HierarchyLevel.GATEWAY));
        assertEquals("e", point.getId(HierarchyLevel.EQUIPMENT));
        assertEquals("t", point.getId(HierarchyLevel.TAG));
    }

    @Test
    public void testAnnotationTakesPartInEquality() {
        DataPoint a = new DataPoint(T, "c", "g", "e", "t", "1");
        DataPoint b = new DataPoint(T, "c", "g", "e", "t", "1");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        a.annotate("average", "60m");
        assertNotEquals(a, b);
        assertEquals("average", a.getAggregationKind());
        assertEquals("60m", a.getTimeWindow());
    }
}
