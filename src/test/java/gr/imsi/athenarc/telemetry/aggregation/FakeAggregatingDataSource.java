package gr.imsi.athenarc.telemetry.aggregation;

import gr.imsi.athenarc.telemetry.datasource.DataSourceException;
import gr.imsi.athenarc.telemetry.datasource.SupportsAggregation;
import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data source that answers aggregated queries from canned results per aggregate function.
 */
class FakeAggregatingDataSource extends FakeDataSource implements SupportsAggregation {

    final List<String> calls = new ArrayList<>();
    final Map<AggregationType, List<DataPoint>> results = new EnumMap<>(AggregationType.class);
    final Set<String> failingWindows = new HashSet<>();

    @Override
    public List<DataPoint> queryAggregatedData(QueryParams params, AggregationType aggregationType, String windowPeriod) {
        calls.add(aggregationType.fluxFunction() + "@" + windowPeriod);
        if (failingWindows.contains(windowPeriod)) {
            throw new DataSourceException("backend rejected window " + windowPeriod);
        }
        List<DataPoint> copies = new ArrayList<>();
        for (DataPoint point : results.getOrDefault(aggregationType, List.of())) {
            copies.add(new DataPoint(point.getTime(), point.getCollectorId(), point.getGatewayId(),
                point.getEquipmentId(), point.getTagId(), point.getValue()));
        }
        return copies;
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.HISTORIAN_API;
    }
}
