package gr.imsi.athenarc.telemetry.datasource;

import java.util.List;

import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

/**
 * Capability of data sources whose backend can compute windowed aggregates itself.
 */
public interface SupportsAggregation {

    /**
     * @param params filters and time range
     * @param aggregationType aggregate function applied per window
     * @param windowPeriod window length such as {@code 5m} or {@code 60m}
     * @return one point per window and series, most recent first
     */
    List<DataPoint> queryAggregatedData(QueryParams params, AggregationType aggregationType, String windowPeriod);
}
