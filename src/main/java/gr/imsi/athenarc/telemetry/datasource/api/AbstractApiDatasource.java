package gr.imsi.athenarc.telemetry.datasource.api;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.DataSourceException;
import gr.imsi.athenarc.telemetry.datasource.config.ApiConfiguration;
import gr.imsi.athenarc.telemetry.datasource.connection.ApiConnection;
import gr.imsi.athenarc.telemetry.domain.ConnectionInfo;
import gr.imsi.athenarc.telemetry.domain.ConnectionResult;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.IdFilter;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Data source backed by the HTTP query API. Subclasses pick the measurement and the
 * capabilities they expose.
 */
public abstract class AbstractApiDatasource implements DataSource {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractApiDatasource.class);

    static final String HEALTH_PATH = "/health";
    static final String QUERY_PATH = "/api/query";
    static final String TAGS_PATH = "/api/tags/";

    protected final ApiConnection apiConnection;
    protected final ApiConfiguration configuration;

    protected AbstractApiDatasource(ApiConnection apiConnection, ApiConfiguration configuration) {
        this.apiConnection = Preconditions.checkNotNull(apiConnection, "apiConnection");
        this.configuration = Preconditions.checkNotNull(configuration, "configuration");
        Preconditions.checkArgument(configuration.isValid(),
            "Invalid API configuration: missing InfluxDB credentials or connection id");
    }

    @Override
    public ConnectionResult testConnection() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            apiConnection.get(HEALTH_PATH);
            Duration latency = stopwatch.elapsed();
            LOG.info("API connection test successful - Latency: {} ms", latency.toMillis());
            return ConnectionResult.success("Connected to " + getDatabaseType().getDisplayName()
                + " - InfluxDB: " + configuration.getInfluxHost() + ":" + configuration.getInfluxPort(), latency,
                ImmutableMap.<String, String>builder()
                    .put("api_url", configuration.getApiUrl())
                    .put("influx_host", Strings.nullToEmpty(configuration.getInfluxHost()))
                    .put("influx_port", String.valueOf(configuration.getInfluxPort()))
                    .put("influx_org", Strings.nullToEmpty(configuration.getOrg()))
                    .put("influx_bucket", Strings.nullToEmpty(configuration.getBucket()))
                    .put("measurement", Strings.nullToEmpty(configuration.getMeasurement()))
                    .build());
        } catch (DataSourceException e) {
            LOG.warn("API connection test failed: {}", e.getMessage());
            return ConnectionResult.failure(e.getMessage(), e, stopwatch.elapsed());
        } catch (RuntimeException e) {
            LOG.error("API connection test failed", e);
            return ConnectionResult.failure("Unexpected error: " + e.getMessage(), e, stopwatch.elapsed());
        }
    }

    @NotNull
    @Override
    public List<DataPoint> queryData(QueryParams params) {
        checkParameters(params);
        LOG.info("Querying {} ({}) for {}", getDatabaseType().getDisplayName(), configuration.getMeasurement(), params);
        return execute(buildRequest(params, null));
    }

    /**
     * Lists the tags the API knows for one of its managed connections.
     */
    public List<ApiTag> getTags(int connectionId) {
        TagsResponse response = apiConnection.get(TAGS_PATH + connectionId, TagsResponse.class);
        if (response == null || response.getTags() == null) {
            return new ArrayList<>();
        }
        return response.getTags();
    }

    @Override
    public ConnectionInfo getConnectionInfo() {
        return ConnectionInfo.builder(getDatabaseType())
            .host(configuration.getApiUrl() + " -> " + configuration.getInfluxHost() + ":" + configuration.getInfluxPort())
            .databaseName(configuration.getOrg() + "/" + configuration.getBucket() + " (" + configuration.getMeasurement() + ")")
            .username(getDatabaseType().getDisplayName())
            .secure(configuration.getApiUrl().toLowerCase(Locale.ROOT).startsWith("https://"))
            .build();
    }

    @Override
    public void close() {
        apiConnection.closeConnection();
    }

    protected List<DataPoint> execute(QueryRequest request) {
        QueryResponse response;
        try {
            response = apiConnection.post(QUERY_PATH, request, QueryResponse.class);
        } catch (DataSourceException e) {
            LOG.error("API query failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during API query", e);
            throw new DataSourceException("Failed to query data from API: " + e.getMessage(), e);
        }
        if (response == null || response.getData() == null) {
            LOG.warn("API returned an empty response");
            return new ArrayList<>();
        }
        LOG.info("Query completed: {} records returned in {} ms", response.getTotalCount(), Math.round(response.getQueryTimeMs()));
        return response.getData().stream()
            .map(DataPointRecord::toDataPoint)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    protected QueryRequest buildRequest(QueryParams params, AggregationRequest aggregation) {
        QueryRequest request = new QueryRequest();
        if (configuration.getConnectionId() != null) {
            request.setConnectionId(configuration.getConnectionId());
        } else {
            request.setInlineCredentials(new InlineCredentials(configuration.getInfluxHost(),
                configuration.getInfluxPort(), configuration.getOrg(), configuration.getBucket(), configuration.getToken()));
        }
        request.setMeasurement(configuration.getMeasurement());
        request.setCollectorIds(toIdList(params.getCollectorId()));
        request.setGatewayIds(toIdList(params.getGatewayId()));
        request.setEquipmentIds(toIdList(params.getEquipmentId()));
        request.setTagIds(toIdList(params.getTagId()));
        request.setStartTime(params.getStartTime());
        request.setEndTime(params.getEndTime());
        request.setLimit(params.getLimit() != null ? params.getLimit() : QueryParams.DEFAULT_LIMIT);
        request.setAggregation(aggregation);
        return request;
    }

    protected void checkParameters(QueryParams params) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkArgument(params.hasValidTimeRange(), INVALID_TIME_RANGE);
    }

    // null tells the API not to filter on that level
    static List<String> toIdList(String filter) {
        List<String> ids = IdFilter.split(filter);
        return ids.isEmpty() ? null : ids;
    }

    public ApiConfiguration getConfiguration() {
        return configuration;
    }
}
