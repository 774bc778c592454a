package gr.imsi.athenarc.telemetry.aggregation;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.domain.ConnectionInfo;
import gr.imsi.athenarc.telemetry.domain.ConnectionResult;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory data source returning a fixed list of points and recording the parameters it was
 * queried with.
 */
class FakeDataSource implements DataSource {

    final List<QueryParams> queries = new ArrayList<>();
    List<DataPoint> points = new ArrayList<>();
    RuntimeException failure;

    @Override
    public ConnectionResult testConnection() {
        return ConnectionResult.success("fake", Duration.ZERO);
    }

    @Override
    public List<DataPoint> queryData(QueryParams params) {
        queries.add(params);
        if (failure != null) {
            throw failure;
        }
        return new ArrayList<>(points);
    }

    @Override
    public ConnectionInfo getConnectionInfo() {
        return ConnectionInfo.builder(getDatabaseType()).host("memory").build();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.AGGREGATES_API;
    }

    @Override
    public void close() {
    }

    static DataPoint point(String tagId, String equipmentId, String value) {
        return new DataPoint(Instant.parse("2024-01-01T10:00:00Z"), "1", "2", equipmentId, tagId, value);
    }
}
