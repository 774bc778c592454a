package gr.imsi.athenarc.telemetry.datasource.influx;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InfluxDBQueryBuilderTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T00:00:00Z");

    private final InfluxDBQueryBuilder builder = new InfluxDBQueryBuilder("telemetry", "raw_readings", "value");

    private QueryParams.Builder params() {
        return QueryParams.builder().startTime(START).endTime(END);
    }

    @Test
    public void testMultiValueFilter() {
        assertEquals("r[\"tag_id\"] == \"10\" or r[\"tag_id\"] == \"20\" or r[\"tag_id\"] == \"30\"",
            InfluxDBQueryBuilder.buildMultiValueFilter("tag_id", "10, 20,30"));
        assertEquals("r[\"tag_id\"] == \"10\"", InfluxDBQueryBuilder.buildMultiValueFilter("tag_id", "10"));
        assertEquals("true", InfluxDBQueryBuilder.buildMultiValueFilter("tag_id", " "));
    }

    @Test
    public void testDataQueryShape() {
        String flux = builder.buildDataQuery(params().collectorId("1").tagId("10, 20,30").limit(100).build(), null);

        assertTrue(flux.startsWith("from(bucket: \"telemetry\")\n"));
        assertTrue(flux.contains("|> range(start: 2024-01-01T00:00:00.000Z, stop: 2024-01-02T00:00:00.000Z)"));
        assertTrue(flux.contains("r[\"_measurement\"] == \"raw_readings\""));
        assertTrue(flux.contains("exists r[\"collector_id\"] and exists r[\"gateway_id\"]"));
        assertTrue(flux.contains("|> filter(fn: (r) => r[\"collector_id\"] == \"1\")"));
        assertTrue(flux.contains("r[\"tag_id\"] == \"10\" or r[\"tag_id\"] == \"20\" or r[\"tag_id\"] == \"30\""));
        assertFalse(flux.contains("r[\"gateway_id\"] =="));
        assertFalse(flux.contains("_field"));

        int group = flux.indexOf("|> group()");
        int sort = flux.indexOf("|> sort(columns: [\"_time\"], desc: true)");
        int limit = flux.indexOf("|> limit(n: 100)");
        assertTrue(group > 0 && sort > group && limit > sort, flux);
    }

    @Test
    public void testNoLimitStage() {
        String flux = builder.buildDataQuery(params().limit(null).build(), null);
        assertFalse(flux.contains("limit("));
    }

    @Test
    public void testAggregatedQuery() {
        String flux = builder.buildAggregatedQuery(params().build(), AggregationType.MEAN, "5m");
        assertTrue(flux.contains("|> map(fn: (r) => ({ r with _value: float(v: r._value) }))"));
        assertTrue(flux.contains("|> aggregateWindow(every: 5m, fn: mean, createEmpty: false)"));
        assertTrue(flux.contains("|> filter(fn: (r) => r[\"_field\"] == \"value\")"));
        assertTrue(flux.indexOf("aggregateWindow") < flux.indexOf("|> group()"));
        assertTrue(flux.contains("desc: true"));
        assertFalse(flux.contains("limit("));
    }

    @Test
    public void testWindowPeriodMustBeADuration() {
        QueryParams p = params().build();
        assertThrows(IllegalArgumentException.class, () -> builder.buildAggregatedQuery(p, AggregationType.MAX, "5m) |> drop()"));
        assertThrows(IllegalArgumentException.class, () -> builder.buildAggregatedQuery(p, AggregationType.MAX, ""));
        assertNotNull(builder.buildAggregatedQuery(p, AggregationType.MAX, "1h30m"));
    }

    @Test
    public void testInvalidRangeIsRejected() {
        QueryParams inverted = QueryParams.builder().startTime(END).endTime(START).build();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> builder.buildDataQuery(inverted, null));
        assertEquals("Invalid parameters: start time must be before end time", e.getMessage());
        assertFalse(builder.validateParameters(null));
    }

    @Test
    public void testIdsAreEscaped() {
        String flux = builder.buildDataQuery(params().tagId("a\"b\\c").build(), null);
        assertTrue(flux.contains("r[\"tag_id\"] == \"a\\\"b\\\\c\""), flux);

        assertEquals("\"\\${x}\"", InfluxDBQueryBuilder.stringLiteral("${x}"));
        assertEquals("\"cost $5\"", InfluxDBQueryBuilder.stringLiteral("cost $5"));
        assertEquals("\"a\\nb\"", InfluxDBQueryBuilder.stringLiteral("a\nb"));
    }

    @Test
    public void testDistinctValuesQuery() {
        Map<HierarchyLevel, String> parents = new EnumMap<>(HierarchyLevel.class);
        parents.put(HierarchyLevel.COLLECTOR, "7");
        parents.put(HierarchyLevel.GATEWAY, " ");
        String flux = builder.buildDistinctValuesQuery(HierarchyLevel.EQUIPMENT, parents, Duration.ofDays(30));
        assertTrue(flux.contains("|> range(start: -720h)"));
        assertTrue(flux.contains("r[\"collector_id\"] == \"7\""));
        assertFalse(flux.contains("gateway_id"));
        assertTrue(flux.contains("|> keep(columns: [\"equipment_id\"])"));
        assertTrue(flux.contains("|> distinct(column: \"equipment_id\")"));
    }

    @Test
    public void testDistinctValuesParentListBecomesAlternatives() {
        Map<HierarchyLevel, String> parents = new EnumMap<>(HierarchyLevel.class);
        parents.put(HierarchyLevel.COLLECTOR, "1,2");
        String flux = builder.buildDistinctValuesQuery(HierarchyLevel.GATEWAY, parents, Duration.ofDays(30));
        assertTrue(flux.contains("|> filter(fn: (r) => r[\"collector_id\"] == \"1\" or r[\"collector_id\"] == \"2\")"), flux);
        assertFalse(flux.contains("\"1,2\""));
    }

    @Test
    public void testShortLookbackIsRenderedInSeconds() {
        String flux = builder.buildDistinctValuesQuery(HierarchyLevel.TAG, null, Duration.ofMinutes(30));
        assertTrue(flux.contains("|> range(start: -1800s)"), flux);
        assertEquals("2h", InfluxDBQueryBuilder.relativeDuration(Duration.ofHours(2)));
        assertEquals("5400s", InfluxDBQueryBuilder.relativeDuration(Duration.ofMinutes(90)));
        assertEquals("1s", InfluxDBQueryBuilder.relativeDuration(Duration.ofMillis(200)));
        assertThrows(IllegalArgumentException.class,
            () -> builder.buildDistinctValuesQuery(HierarchyLevel.TAG, null, Duration.ZERO));
    }
}
