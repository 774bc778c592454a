package gr.imsi.athenarc.telemetry.datasource;

import java.util.List;
import java.util.Optional;

import gr.imsi.athenarc.telemetry.domain.ConnectionInfo;
import gr.imsi.athenarc.telemetry.domain.ConnectionResult;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.QueryParams;

/**
 * Represents a telemetry data source. Optional behaviour is exposed through capability
 * interfaces ({@link SupportsAggregation}, {@link SupportsRawTableAccess},
 * {@link SupportsHierarchyDiscovery}) that an implementation may or may not add.
 * <p>
 * A data source owns its underlying client or connection until {@link #close()} is called.
 * Instances are not meant to be shared between threads issuing overlapping calls.
 */
public interface DataSource extends AutoCloseable {

    String INVALID_TIME_RANGE = "Invalid parameters: start time must be before end time";

    /**
     * Checks that the backend is reachable and the credentials are accepted. Transport,
     * authentication and timeout failures are reported through the result, not thrown.
     */
    ConnectionResult testConnection();

    /**
     * Returns the raw data points matching the given parameters.
     * @param params filters, time range and limit
     * @return data points, most recent first
     * @throws NullPointerException if params is null
     * @throws IllegalArgumentException if the start time is not before the end time
     * @throws DataSourceException if the backend query fails
     */
    List<DataPoint> queryData(QueryParams params);

    ConnectionInfo getConnectionInfo();

    DatabaseType getDatabaseType();

    /**
     * Returns this data source viewed as the given capability, if it has it.
     */
    default <T> Optional<T> capability(Class<T> capabilityType) {
        return capabilityType.isInstance(this) ? Optional.of(capabilityType.cast(this)) : Optional.empty();
    }

    @Override
    void close();

}
