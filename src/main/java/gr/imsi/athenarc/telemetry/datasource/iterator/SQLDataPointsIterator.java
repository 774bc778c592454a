package gr.imsi.athenarc.telemetry.datasource.iterator;

import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Maps rows of the queries built by
 * {@link gr.imsi.athenarc.telemetry.datasource.sql.SQLQueryBuilder} to data points.
 * NULL columns become empty strings.
 */
public class SQLDataPointsIterator extends SQLIterator<DataPoint> {

    public static final String TIME_ALIAS = "time";
    public static final String VALUE_ALIAS = "value";

    public SQLDataPointsIterator(ResultSet resultSet) {
        super(resultSet);
    }

    @Override
    protected DataPoint getNext() throws SQLException {
        Instant time = getInstant(TIME_ALIAS);
        if (time == null) {
            LOG.debug("Row without timestamp, using current time");
        }
        return new DataPoint(
            time,
            getSafeStringValue(HierarchyLevel.COLLECTOR.getDefaultColumn()),
            getSafeStringValue(HierarchyLevel.GATEWAY.getDefaultColumn()),
            getSafeStringValue(HierarchyLevel.EQUIPMENT.getDefaultColumn()),
            getSafeStringValue(HierarchyLevel.TAG.getDefaultColumn()),
            getSafeStringValue(VALUE_ALIAS));
    }
}
