package gr.imsi.athenarc.telemetry.datasource.executor;

import com.influxdb.client.QueryApi;
import com.influxdb.client.domain.Dialect;

import gr.imsi.athenarc.telemetry.datasource.connection.InfluxDBConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Executes Flux queries and hands back the annotated CSV response as text.
 */
public class InfluxDBQueryExecutor implements QueryExecutor<String, String> {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBQueryExecutor.class);

    // Header row preceded by a single #datatype annotation row
    static final Dialect CSV_DIALECT = new Dialect()
        .header(true)
        .delimiter(",")
        .commentPrefix("#")
        .annotations(List.of(Dialect.AnnotationsEnum.DATATYPE))
        .dateTimeFormat(Dialect.DateTimeFormatEnum.RFC3339);

    private final InfluxDBConnection databaseConnection;

    public InfluxDBQueryExecutor(InfluxDBConnection databaseConnection) {
        this.databaseConnection = databaseConnection;
    }

    @Override
    public String executeDbQuery(String query) {
        QueryApi queryApi = databaseConnection.getClient().getQueryApi();
        LOG.info("Executing Query: \n" + query);
        String response = queryApi.queryRaw(query, CSV_DIALECT, databaseConnection.getOrg());
        LOG.debug("Received {} characters", response == null ? 0 : response.length());
        return response == null ? "" : response;
    }

    @Override
    public void closeConnection() {
        databaseConnection.closeConnection();
    }

    public InfluxDBConnection getConnection() {
        return databaseConnection;
    }

}
