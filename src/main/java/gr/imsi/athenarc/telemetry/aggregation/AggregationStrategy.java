package gr.imsi.athenarc.telemetry.aggregation;

import gr.imsi.athenarc.telemetry.domain.AggregationConfiguration;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

import java.util.List;

/**
 * Produces the aggregated points for every requested (kind, window) pair of an
 * {@link AggregationConfiguration}. Returned points carry their kind and window through
 * {@link DataPoint#annotate(String, String)}.
 */
public interface AggregationStrategy {

    List<DataPoint> applyAggregation(QueryParams params, AggregationConfiguration config);

    String getDescription();
}
