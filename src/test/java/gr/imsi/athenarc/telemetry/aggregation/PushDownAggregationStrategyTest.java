package gr.imsi.athenarc.telemetry.aggregation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.telemetry.domain.AggregationConfiguration;
import gr.imsi.athenarc.telemetry.domain.AggregationKind;
import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TimeWindow;

import java.time.Instant;
import java.util.List;

import static gr.imsi.athenarc.telemetry.aggregation.FakeDataSource.point;
import static org.junit.jupiter.api.Assertions.*;

public class PushDownAggregationStrategyTest {

    private final QueryParams params = QueryParams.builder()
        .tagId("4")
        .startTime(Instant.parse("2024-01-01T00:00:00Z"))
        .endTime(Instant.parse("2024-01-02T00:00:00Z"))
        .build();

    private FakeAggregatingDataSource dataSource;
    private PushDownAggregationStrategy strategy;

    @BeforeEach
    public void setUp() {
        dataSource = new FakeAggregatingDataSource();
        strategy = new PushDownAggregationStrategy(dataSource);
    }

    private static AggregationConfiguration config(AggregationKind kind, TimeWindow... windows) {
        return new AggregationConfiguration(List.of(kind), List.of(windows), DatabaseType.HISTORIAN_API);
    }

    @Test
    public void testAverageAndTotalMapToMeanAndSum() {
        dataSource.results.put(AggregationType.MEAN, List.of(point("4", "3", "10.0")));
        dataSource.results.put(AggregationType.SUM, List.of(point("4", "3", "120.0")));

        List<DataPoint> result = strategy.applyAggregation(params, new AggregationConfiguration(
            List.of(AggregationKind.AVERAGE, AggregationKind.TOTAL),
            List.of(TimeWindow.FIVE_MINUTES, TimeWindow.SIXTY_MINUTES), DatabaseType.HISTORIAN_API));

        assertEquals(List.of("mean@5m", "mean@60m", "sum@5m", "sum@60m"), dataSource.calls);
        assertEquals(4, result.size());
        assertEquals("average", result.get(0).getAggregationKind());
        assertEquals("5m", result.get(0).getTimeWindow());
        assertEquals("total", result.get(3).getAggregationKind());
        assertEquals("60m", result.get(3).getTimeWindow());
    }

    @Test
    public void testMinMaxIssuesTwoQueries() {
        dataSource.results.put(AggregationType.MIN, List.of(point("4", "3", "1.0")));
        dataSource.results.put(AggregationType.MAX, List.of(point("4", "3", "9.0")));

        List<DataPoint> result = strategy.applyAggregation(params, config(AggregationKind.MIN_MAX, TimeWindow.FIVE_MINUTES));

        assertEquals(List.of("min@5m", "max@5m"), dataSource.calls);
        assertEquals(2, result.size());
        assertEquals("min_max_min", result.get(0).getAggregationKind());
        assertEquals("1.0", result.get(0).getValue());
        assertEquals("min_max_max", result.get(1).getAggregationKind());
        assertEquals("5m", result.get(1).getTimeWindow());
    }

    @Test
    public void testFirstLastTagsBothSides() {
        dataSource.results.put(AggregationType.FIRST, List.of(point("4", "3", "1.0")));
        dataSource.results.put(AggregationType.LAST, List.of(point("4", "3", "2.0")));

        List<DataPoint> result = strategy.applyAggregation(params, config(AggregationKind.FIRST_LAST, TimeWindow.FIFTEEN_MINUTES));

        assertEquals(List.of("first_last_first", "first_last_last"),
            List.of(result.get(0).getAggregationKind(), result.get(1).getAggregationKind()));
    }

    @Test
    public void testDeltaSubtractsFirstFromLast() {
        dataSource.results.put(AggregationType.FIRST, List.of(point("4", "3", "10.0"), point("5", "3", "1.0")));
        dataSource.results.put(AggregationType.LAST, List.of(point("4", "3", "14.5"), point("6", "3", "8.0")));

        List<DataPoint> result = strategy.applyAggregation(params, config(AggregationKind.DELTA, TimeWindow.THIRTY_MINUTES));

        assertEquals(List.of("first@30m", "last@30m"), dataSource.calls);
        assertEquals(1, result.size());
        DataPoint delta = result.get(0);
        assertEquals("4", delta.getTagId());
        assertEquals("4.50", delta.getValue());
        assertEquals("delta", delta.getAggregationKind());
        assertEquals("30m", delta.getTimeWindow());
    }

    @Test
    public void testDeltaUsesFirstOccurrencePerTagAndLastSideMetadata() {
        Instant lastTime = Instant.parse("2024-01-01T23:00:00Z");
        List<DataPoint> first = List.of(point("4", "3", "1.0"), point("4", "3", "100.0"));
        List<DataPoint> last = List.of(new DataPoint(lastTime, "7", "8", "9", "4", "3.25"), point("4", "3", "-50"));

        List<DataPoint> result = PushDownAggregationStrategy.computeDeltas(first, last, "delta", "5m");

        assertEquals(1, result.size());
        assertEquals("2.25", result.get(0).getValue());
        assertEquals(lastTime, result.get(0).getTime());
        assertEquals("7", result.get(0).getCollectorId());
        assertEquals("9", result.get(0).getEquipmentId());
    }

    @Test
    public void testDeltaDropsNonNumericPairsAndFormatsNegatives() {
        List<DataPoint> first = List.of(point("4", "3", "abc"), point("5", "3", "10"));
        List<DataPoint> last = List.of(point("4", "3", "2.0"), point("5", "3", "7.25"));

        List<DataPoint> result = PushDownAggregationStrategy.computeDeltas(first, last, "delta", "5m");

        assertEquals(1, result.size());
        assertEquals("5", result.get(0).getTagId());
        assertEquals("-2.75", result.get(0).getValue());
    }

    @Test
    public void testFailingPairDoesNotStopTheOthers() {
        dataSource.results.put(AggregationType.MEAN, List.of(point("4", "3", "10.0")));
        dataSource.failingWindows.add("15m");

        List<DataPoint> result = strategy.applyAggregation(params, config(AggregationKind.AVERAGE,
            TimeWindow.FIVE_MINUTES, TimeWindow.FIFTEEN_MINUTES, TimeWindow.SIXTY_MINUTES));

        assertEquals(List.of("mean@5m", "mean@15m", "mean@60m"), dataSource.calls);
        assertEquals(2, result.size());
        assertEquals("60m", result.get(1).getTimeWindow());
    }

    @Test
    public void testRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new PushDownAggregationStrategy(new FakeDataSource()));
        assertThrows(NullPointerException.class,
            () -> strategy.applyAggregation(null, config(AggregationKind.AVERAGE, TimeWindow.FIVE_MINUTES)));
        assertThrows(IllegalArgumentException.class, () -> strategy.applyAggregation(params,
            new AggregationConfiguration(List.of(), List.of(TimeWindow.FIVE_MINUTES), DatabaseType.HISTORIAN_API)));
        assertTrue(dataSource.calls.isEmpty());
    }

    @Test
    public void testDescription() {
        assertEquals("Apply aggregation to raw data", strategy.getDescription());
    }
}
