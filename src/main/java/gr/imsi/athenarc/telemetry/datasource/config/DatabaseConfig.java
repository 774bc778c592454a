package gr.imsi.athenarc.telemetry.datasource.config;

import com.google.common.base.Strings;

import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

/**
 * Backend-independent descriptor the {@link gr.imsi.athenarc.telemetry.datasource.DataSourceFactory}
 * turns into a live data source.
 */
public class DatabaseConfig {

    public static final String CURRENT_VERSION = "1.0";

    private DatabaseType databaseType;
    private ConnectionSettings connectionSettings = new ConnectionSettings();
    private TableSchema tableSchema;
    private String configVersion = CURRENT_VERSION;

    public DatabaseConfig() {}

    public DatabaseConfig(DatabaseType databaseType, ConnectionSettings connectionSettings) {
        this.databaseType = databaseType;
        this.connectionSettings = connectionSettings;
    }

    /**
     * Checks that the fields the declared backend needs are present. Time-series and API
     * backends need a url and a token, relational backends need either a connection string or
     * host, port, database name and username.
     */
    public boolean isValid() {
        if (databaseType == null || connectionSettings == null) {
            return false;
        }
        ConnectionSettings settings = connectionSettings;
        if (databaseType.isRelational()) {
            if (!Strings.isNullOrEmpty(settings.getConnectionString())) {
                return true;
            }
            return !Strings.isNullOrEmpty(settings.getHost())
                && settings.getPort() > 0
                && !Strings.isNullOrEmpty(settings.getDatabaseName())
                && !Strings.isNullOrEmpty(settings.getUsername());
        }
        return !Strings.isNullOrEmpty(settings.getUrl())
            && !Strings.isNullOrEmpty(settings.getEncryptedToken());
    }

    public DatabaseType getDatabaseType() { return databaseType; }
    public ConnectionSettings getConnectionSettings() { return connectionSettings; }
    public TableSchema getTableSchema() { return tableSchema; }
    public String getConfigVersion() { return configVersion; }

    public void setDatabaseType(DatabaseType databaseType) { this.databaseType = databaseType; }
    public void setConnectionSettings(ConnectionSettings connectionSettings) { this.connectionSettings = connectionSettings; }
    public void setTableSchema(TableSchema tableSchema) { this.tableSchema = tableSchema; }
    public void setConfigVersion(String configVersion) { this.configVersion = configVersion; }

    @Override
    public String toString() {
        return "DatabaseConfig{" + databaseType + ", version=" + configVersion + '}';
    }
}
