package gr.imsi.athenarc.telemetry.aggregation;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.telemetry.domain.DatabaseType;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationStrategyFactoryTest {

    @Test
    public void testStrategyPerBackend() {
        assertTrue(AggregationStrategyFactory.createStrategy(DatabaseType.HISTORIAN_API, new FakeAggregatingDataSource())
            instanceof PushDownAggregationStrategy);
        assertTrue(AggregationStrategyFactory.createStrategy(DatabaseType.AGGREGATES_API, new FakeDataSource())
            instanceof LocalFilterAggregationStrategy);
    }

    @Test
    public void testUnsupportedBackends() {
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
            () -> AggregationStrategyFactory.createStrategy(DatabaseType.INFLUXDB, new FakeDataSource()));
        assertTrue(e.getMessage().contains("INFLUXDB"));
        assertTrue(e.getMessage().contains("HISTORIAN_API, AGGREGATES_API"));
        assertThrows(NullPointerException.class, () -> AggregationStrategyFactory.createStrategy(null, new FakeDataSource()));
    }

    @Test
    public void testSupportAndDescriptions() {
        assertTrue(AggregationStrategyFactory.isAggregationSupported(DatabaseType.HISTORIAN_API));
        assertTrue(AggregationStrategyFactory.isAggregationSupported(DatabaseType.AGGREGATES_API));
        assertFalse(AggregationStrategyFactory.isAggregationSupported(DatabaseType.POSTGRESQL));
        assertFalse(AggregationStrategyFactory.isAggregationSupported(null));

        assertEquals("Apply aggregation to raw data", AggregationStrategyFactory.getAggregationDescription(DatabaseType.HISTORIAN_API));
        assertEquals("Filter pre-aggregated data", AggregationStrategyFactory.getAggregationDescription(DatabaseType.AGGREGATES_API));
        assertEquals("Aggregation not supported", AggregationStrategyFactory.getAggregationDescription(DatabaseType.INFLUXDB));
    }
}
