package gr.imsi.athenarc.telemetry.aggregation;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;

/**
 * Picks the aggregation strategy matching how a backend stores its data.
 */
public final class AggregationStrategyFactory {

    static final String PUSH_DOWN_DESCRIPTION = "Apply aggregation to raw data";
    static final String LOCAL_FILTER_DESCRIPTION = "Filter pre-aggregated data";
    static final String NOT_SUPPORTED_DESCRIPTION = "Aggregation not supported";

    private AggregationStrategyFactory() {}

    public static AggregationStrategy createStrategy(DatabaseType databaseType, DataSource dataSource) {
        Preconditions.checkNotNull(databaseType, "databaseType");
        Preconditions.checkNotNull(dataSource, "dataSource");
        switch (databaseType) {
            case HISTORIAN_API:
                return new PushDownAggregationStrategy(dataSource);
            case AGGREGATES_API:
                return new LocalFilterAggregationStrategy(dataSource);
            default:
                throw new UnsupportedOperationException("Aggregation is not supported for database type: "
                    + databaseType + ". Supported types: " + DatabaseType.HISTORIAN_API + ", " + DatabaseType.AGGREGATES_API);
        }
    }

    public static boolean isAggregationSupported(DatabaseType databaseType) {
        return databaseType == DatabaseType.HISTORIAN_API || databaseType == DatabaseType.AGGREGATES_API;
    }

    public static String getAggregationDescription(DatabaseType databaseType) {
        if (databaseType == DatabaseType.HISTORIAN_API) {
            return PUSH_DOWN_DESCRIPTION;
        }
        if (databaseType == DatabaseType.AGGREGATES_API) {
            return LOCAL_FILTER_DESCRIPTION;
        }
        return NOT_SUPPORTED_DESCRIPTION;
    }
}
