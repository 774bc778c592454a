package gr.imsi.athenarc.telemetry.datasource.api;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.SupportsAggregation;
import gr.imsi.athenarc.telemetry.datasource.config.ApiConfiguration;
import gr.imsi.athenarc.telemetry.datasource.connection.ApiConnection;
import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

import java.util.List;

/**
 * Raw readings through the query API, which can also aggregate them on request.
 */
public class HistorianApiDatasource extends AbstractApiDatasource implements SupportsAggregation {

    private static final Logger LOG = LoggerFactory.getLogger(HistorianApiDatasource.class);

    public HistorianApiDatasource(ApiConnection apiConnection, ApiConfiguration configuration) {
        super(apiConnection, configuration);
    }

    @Override
    public List<DataPoint> queryAggregatedData(QueryParams params, AggregationType aggregationType, String windowPeriod) {
        checkParameters(params);
        Preconditions.checkNotNull(aggregationType, "aggregationType");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(windowPeriod), "windowPeriod is required");
        LOG.info("Requesting {} over {} windows", aggregationType.fluxFunction(), windowPeriod);
        List<DataPoint> dataPoints = execute(buildRequest(params,
            new AggregationRequest(aggregationType.fluxFunction(), windowPeriod)));
        LOG.info("Aggregated query returned {} points", dataPoints.size());
        return dataPoints;
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.HISTORIAN_API;
    }
}
