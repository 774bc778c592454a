package gr.imsi.athenarc.telemetry.datasource;

import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

/**
 * Translates backend-neutral query parameters into a backend's native query.
 * @param <Q> the native query representation
 */
public interface QueryBuilder<Q> {

    String buildTestQuery();

    /**
     * @param params filters, time range and limit
     * @param schema table layout, ignored by builders whose backend has a fixed layout
     */
    Q buildDataQuery(QueryParams params, TableSchema schema);

    /** @return true if the parameters are present and the start time is before the end time */
    default boolean validateParameters(QueryParams params) {
        return params != null && params.hasValidTimeRange();
    }
}
