package gr.imsi.athenarc.telemetry.domain;

/**
 * Read-only description of what a data source is connected to.
 */
public final class ConnectionInfo {

    private final DatabaseType databaseType;
    private final String host;
    private final String databaseName;
    private final String username;
    private final boolean secure;
    private final String serverVersion;

    private ConnectionInfo(Builder builder) {
        this.databaseType = builder.databaseType;
        this.host = builder.host;
        this.databaseName = builder.databaseName;
        this.username = builder.username;
        this.secure = builder.secure;
        this.serverVersion = builder.serverVersion;
    }

    public DatabaseType getDatabaseType() { return databaseType; }
    public String getHost() { return host; }
    public String getDatabaseName() { return databaseName; }
    public String getUsername() { return username; }
    public boolean isSecure() { return secure; }
    public String getServerVersion() { return serverVersion; }

    public static Builder builder(DatabaseType databaseType) {
        return new Builder(databaseType);
    }

    @Override
    public String toString() {
        return databaseType.getDisplayName() + " - " + host + "/" + databaseName;
    }

    public static class Builder {
        private final DatabaseType databaseType;
        private String host;
        private String databaseName;
        private String username;
        private boolean secure;
        private String serverVersion;

        private Builder(DatabaseType databaseType) {
            this.databaseType = databaseType;
        }

        public Builder host(String host) { this.host = host; return this; }
        public Builder databaseName(String databaseName) { this.databaseName = databaseName; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder secure(boolean secure) { this.secure = secure; return this; }
        public Builder serverVersion(String serverVersion) { this.serverVersion = serverVersion; return this; }

        public ConnectionInfo build() {
            return new ConnectionInfo(this);
        }
    }
}
