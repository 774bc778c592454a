package gr.imsi.athenarc.telemetry.datasource.api;

import gr.imsi.athenarc.telemetry.datasource.config.ApiConfiguration;
import gr.imsi.athenarc.telemetry.datasource.connection.ApiConnection;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;

/**
 * Already aggregated rows through the query API.
 * <p>
 * In this store the gateway level holds the aggregated field name and the equipment level holds
 * {@code <kind>_<window>}, e.g. {@code average_60m}. Selecting aggregations therefore happens
 * client side, see {@link gr.imsi.athenarc.telemetry.aggregation.LocalFilterAggregationStrategy}.
 */
public class AggregatesApiDatasource extends AbstractApiDatasource {

    public AggregatesApiDatasource(ApiConnection apiConnection, ApiConfiguration configuration) {
        super(apiConnection, configuration);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.AGGREGATES_API;
    }
}
