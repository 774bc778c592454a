package gr.imsi.athenarc.telemetry.datasource.config;

import com.google.common.base.Strings;

import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

public class SQLConfiguration implements DataSourceConfiguration {

    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_SOCKET_TIMEOUT_SECONDS = 60;

    private String url;
    private String host;
    private int port;
    private String databaseName;
    private String username;
    private String password;
    private boolean useSsl;
    private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
    private int socketTimeoutSeconds = DEFAULT_SOCKET_TIMEOUT_SECONDS;
    private TableSchema tableSchema = new TableSchema();

    private SQLConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String url;
        private String host = "localhost";
        private int port = DatabaseType.POSTGRESQL.getDefaultPort();
        private String databaseName;
        private String username;
        private String password;
        private boolean useSsl;
        private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
        private int socketTimeoutSeconds = DEFAULT_SOCKET_TIMEOUT_SECONDS;
        private TableSchema tableSchema = new TableSchema();

        /** Explicit JDBC url; when set it wins over host, port and database name. */
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder useSsl(boolean useSsl) {
            this.useSsl = useSsl;
            return this;
        }

        public Builder connectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
            return this;
        }

        public Builder socketTimeoutSeconds(int socketTimeoutSeconds) {
            this.socketTimeoutSeconds = socketTimeoutSeconds;
            return this;
        }

        public Builder tableSchema(TableSchema tableSchema) {
            this.tableSchema = tableSchema;
            return this;
        }

        public SQLConfiguration build() {
            SQLConfiguration config = new SQLConfiguration();
            config.url = this.url;
            config.host = this.host;
            config.port = this.port;
            config.databaseName = this.databaseName;
            config.username = this.username;
            config.password = this.password;
            config.useSsl = this.useSsl;
            config.connectTimeoutSeconds = this.connectTimeoutSeconds;
            config.socketTimeoutSeconds = this.socketTimeoutSeconds;
            config.tableSchema = this.tableSchema != null ? this.tableSchema : new TableSchema();
            return config;
        }
    }

    /**
     * @return the explicit url if one was given, otherwise a PostgreSQL url built from host, port
     * and database name
     */
    public String getJdbcUrl() {
        if (!Strings.isNullOrEmpty(url)) {
            return url;
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + Strings.nullToEmpty(databaseName);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    public boolean isValid() {
        if (!Strings.isNullOrEmpty(url)) {
            return true;
        }
        return !Strings.isNullOrEmpty(host) && port > 0
            && !Strings.isNullOrEmpty(databaseName) && !Strings.isNullOrEmpty(username);
    }

    public String getUrl() { return url; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabaseName() { return databaseName; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public boolean isUseSsl() { return useSsl; }
    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public int getSocketTimeoutSeconds() { return socketTimeoutSeconds; }
    public TableSchema getTableSchema() { return tableSchema; }

    public void setTableSchema(TableSchema tableSchema) { this.tableSchema = tableSchema; }

}
