package gr.imsi.athenarc.telemetry.datasource.influx;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.exceptions.UnauthorizedException;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.DataSourceException;
import gr.imsi.athenarc.telemetry.datasource.SupportsAggregation;
import gr.imsi.athenarc.telemetry.datasource.SupportsHierarchyDiscovery;
import gr.imsi.athenarc.telemetry.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.telemetry.datasource.executor.InfluxDBQueryExecutor;
import gr.imsi.athenarc.telemetry.domain.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public class InfluxDBDatasource implements DataSource, SupportsAggregation, SupportsHierarchyDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBDatasource.class);

    public static final Duration DEFAULT_DISCOVERY_LOOKBACK = Duration.ofDays(30);

    private final InfluxDBQueryExecutor influxDBQueryExecutor;
    private final InfluxDBConfiguration configuration;
    private final InfluxDBQueryBuilder queryBuilder;
    private final InfluxDBResponseParser responseParser;

    private String lastQueryExecuted;
    private String lastRawResponse;

    public InfluxDBDatasource(InfluxDBQueryExecutor influxDBQueryExecutor, InfluxDBConfiguration configuration,
                              InfluxDBQueryBuilder queryBuilder, InfluxDBResponseParser responseParser) {
        this.influxDBQueryExecutor = Preconditions.checkNotNull(influxDBQueryExecutor, "influxDBQueryExecutor");
        this.configuration = Preconditions.checkNotNull(configuration, "configuration");
        this.queryBuilder = Preconditions.checkNotNull(queryBuilder, "queryBuilder");
        this.responseParser = Preconditions.checkNotNull(responseParser, "responseParser");
    }

    @Override
    public ConnectionResult testConnection() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            execute(queryBuilder.buildTestQuery());
            Duration latency = stopwatch.elapsed();
            LOG.info("InfluxDB connection test successful - Latency: {} ms", latency.toMillis());
            Map<String, String> metadata = ImmutableMap.of(
                "Url", Strings.nullToEmpty(configuration.getUrl()),
                "Org", Strings.nullToEmpty(configuration.getOrg()),
                "Bucket", Strings.nullToEmpty(configuration.getBucket()));
            return ConnectionResult.success("InfluxDB connection successful", latency, metadata);
        } catch (UnauthorizedException e) {
            LOG.error("InfluxDB connection test failed: authentication rejected", e);
            return ConnectionResult.failure("Authentication failed: " + e.getMessage(), e, stopwatch.elapsed());
        } catch (InfluxException e) {
            LOG.error("InfluxDB connection test failed", e);
            return ConnectionResult.failure("HTTP request failed: " + e.getMessage(), e, stopwatch.elapsed());
        } catch (RuntimeException e) {
            LOG.error("InfluxDB connection test failed", e);
            return ConnectionResult.failure("Unexpected error: " + e.getMessage(), e, stopwatch.elapsed());
        }
    }

    @NotNull
    @Override
    public List<DataPoint> queryData(QueryParams params) {
        checkParameters(params);
        String query = queryBuilder.buildDataQuery(params, null);
        try {
            List<DataPoint> dataPoints = responseParser.parse(execute(query));
            LOG.info("Query returned {} data points", dataPoints.size());
            return dataPoints;
        } catch (RuntimeException e) {
            LOG.error("Error querying InfluxDB", e);
            throw new DataSourceException("Failed to query data: " + e.getMessage(), e);
        }
    }

    @Override
    public List<DataPoint> queryAggregatedData(QueryParams params, AggregationType aggregationType, String windowPeriod) {
        checkParameters(params);
        Preconditions.checkNotNull(aggregationType, "aggregationType");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(windowPeriod), "windowPeriod is required");
        String query = queryBuilder.buildAggregatedQuery(params, aggregationType, windowPeriod);
        try {
            List<DataPoint> dataPoints = responseParser.parse(execute(query));
            LOG.info("Aggregated query ({} over {}) returned {} data points", aggregationType, windowPeriod, dataPoints.size());
            return dataPoints;
        } catch (RuntimeException e) {
            LOG.error("Error querying aggregated data from InfluxDB", e);
            throw new DataSourceException("Failed to query aggregated data: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> getAvailableIds(HierarchyLevel level, Map<HierarchyLevel, String> parentIds) {
        Preconditions.checkNotNull(level, "level");
        String query = queryBuilder.buildDistinctValuesQuery(level, parentIds, DEFAULT_DISCOVERY_LOOKBACK);
        try {
            // distinct() emits the values in _value
            List<String> ids = responseParser.parseDistinctValues(execute(query), InfluxDBResponseParser.VALUE_COLUMN);
            LOG.debug("Found {} {} values", ids.size(), level);
            return ids;
        } catch (RuntimeException e) {
            LOG.error("Error listing {} values", level, e);
            return List.of();
        }
    }

    @Override
    public ConnectionInfo getConnectionInfo() {
        return ConnectionInfo.builder(DatabaseType.INFLUXDB)
            .host(configuration.getUrl())
            .databaseName(configuration.getBucket())
            .username(configuration.getOrg())
            .secure(configuration.isSecure())
            .build();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.INFLUXDB;
    }

    @Override
    public void close() {
        influxDBQueryExecutor.closeConnection();
    }

    /** The last Flux query sent, for diagnostics. */
    public String getLastQueryExecuted() {
        return lastQueryExecuted;
    }

    /** The raw response to {@link #getLastQueryExecuted()}, for diagnostics. */
    public String getLastRawResponse() {
        return lastRawResponse;
    }

    private String execute(String query) {
        lastQueryExecuted = query;
        String response = influxDBQueryExecutor.executeDbQuery(query);
        lastRawResponse = response;
        return response;
    }

    private void checkParameters(QueryParams params) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkArgument(queryBuilder.validateParameters(params), INVALID_TIME_RANGE);
    }
}
