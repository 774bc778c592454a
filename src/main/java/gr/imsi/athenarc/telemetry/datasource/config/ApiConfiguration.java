package gr.imsi.athenarc.telemetry.datasource.config;

import com.google.common.base.Strings;

import gr.imsi.athenarc.telemetry.domain.DatabaseType;

/**
 * Settings for the HTTP query API. Requests either name a connection managed by the API or
 * carry the InfluxDB credentials inline.
 */
public class ApiConfiguration implements DataSourceConfiguration {

    public static final String DEFAULT_API_URL = "http://localhost:8000";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final String DEFAULT_AGGREGATES_MEASUREMENT = "aggregated_readings";

    private final DatabaseType databaseType;
    private final String apiUrl;
    private final String influxHost;
    private final int influxPort;
    private final String org;
    private final String bucket;
    private final String token;
    private final String measurement;
    private final Integer connectionId;
    private final int timeoutSeconds;

    private ApiConfiguration(Builder builder) {
        this.databaseType = builder.databaseType;
        this.apiUrl = builder.apiUrl;
        this.influxHost = builder.influxHost;
        this.influxPort = builder.influxPort;
        this.org = builder.org;
        this.bucket = builder.bucket;
        this.token = builder.token;
        this.measurement = builder.measurement;
        this.connectionId = builder.connectionId;
        this.timeoutSeconds = builder.timeoutSeconds;
    }

    @Override
    public DatabaseType getDatabaseType() { return databaseType; }
    public String getApiUrl() { return apiUrl; }
    public String getInfluxHost() { return influxHost; }
    public int getInfluxPort() { return influxPort; }
    public String getOrg() { return org; }
    public String getBucket() { return bucket; }
    public String getToken() { return token; }
    public String getMeasurement() { return measurement; }
    public Integer getConnectionId() { return connectionId; }
    public int getTimeoutSeconds() { return timeoutSeconds; }

    @Override
    public boolean isValid() {
        if (Strings.isNullOrEmpty(apiUrl) || timeoutSeconds <= 0) {
            return false;
        }
        return connectionId != null || hasInlineCredentials();
    }

    /** True when every InfluxDB field needed to send credentials inline is present. */
    public boolean hasInlineCredentials() {
        return !Strings.isNullOrEmpty(influxHost)
            && influxPort > 0
            && !Strings.isNullOrEmpty(org)
            && !Strings.isNullOrEmpty(bucket)
            && !Strings.isNullOrEmpty(token);
    }

    public static Builder builder(DatabaseType databaseType) {
        return new Builder(databaseType);
    }

    public static class Builder {
        private final DatabaseType databaseType;
        private String apiUrl = DEFAULT_API_URL;
        private String influxHost;
        private int influxPort = DatabaseType.INFLUXDB.getDefaultPort();
        private String org, bucket, token, measurement;
        private Integer connectionId;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

        private Builder(DatabaseType databaseType) {
            if (!databaseType.isApi()) {
                throw new IllegalArgumentException(databaseType + " is not an API database type");
            }
            this.databaseType = databaseType;
            this.measurement = databaseType == DatabaseType.AGGREGATES_API
                ? DEFAULT_AGGREGATES_MEASUREMENT : InfluxDBConfiguration.DEFAULT_MEASUREMENT;
        }

        public Builder apiUrl(String apiUrl) { this.apiUrl = apiUrl; return this; }
        public Builder influxHost(String influxHost) { this.influxHost = influxHost; return this; }
        public Builder influxPort(int influxPort) { this.influxPort = influxPort; return this; }
        public Builder org(String org) { this.org = org; return this; }
        public Builder bucket(String bucket) { this.bucket = bucket; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder measurement(String measurement) { this.measurement = measurement; return this; }
        public Builder connectionId(Integer connectionId) { this.connectionId = connectionId; return this; }
        public Builder timeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; return this; }

        public ApiConfiguration build() {
            return new ApiConfiguration(this);
        }
    }
}
