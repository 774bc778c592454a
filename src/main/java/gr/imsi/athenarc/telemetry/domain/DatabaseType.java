package gr.imsi.athenarc.telemetry.domain;

/**
 * Backend families a {@link gr.imsi.athenarc.telemetry.datasource.DataSource} can be created for.
 */
public enum DatabaseType {
    INFLUXDB("InfluxDB", 8086, Family.TIME_SERIES),
    POSTGRESQL("PostgreSQL", 5432, Family.RELATIONAL),
    MYSQL("MySQL", 3306, Family.RELATIONAL),
    ORACLE("Oracle", 1521, Family.RELATIONAL),
    SQL_SERVER("SQL Server", 1433, Family.RELATIONAL),
    /** HTTP query API in front of the raw time-series store. Computes aggregations on request. */
    HISTORIAN_API("Historian API", 8000, Family.API),
    /** HTTP query API in front of a store that already holds aggregated rows. */
    AGGREGATES_API("Aggregates API", 8000, Family.API);

    private enum Family { TIME_SERIES, RELATIONAL, API }

    private final String displayName;
    private final int defaultPort;
    private final Family family;

    DatabaseType(String displayName, int defaultPort, Family family) {
        this.displayName = displayName;
        this.defaultPort = defaultPort;
        this.family = family;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public boolean isRelational() {
        return family == Family.RELATIONAL;
    }

    public boolean isTimeSeries() {
        return family == Family.TIME_SERIES;
    }

    public boolean isApi() {
        return family == Family.API;
    }
}
