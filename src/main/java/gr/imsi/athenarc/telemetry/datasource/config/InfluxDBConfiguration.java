package gr.imsi.athenarc.telemetry.datasource.config;

import com.google.common.base.Strings;

import gr.imsi.athenarc.telemetry.domain.DatabaseType;

public class InfluxDBConfiguration implements DataSourceConfiguration {

    public static final String DEFAULT_MEASUREMENT = "raw_readings";
    public static final String DEFAULT_VALUE_FIELD = "value";

    private final String url;
    private final String org;
    private final String token;
    private final String bucket;
    private final String measurement;
    private final String valueField;

    private InfluxDBConfiguration(Builder builder) {
        this.url = builder.url;
        this.org = builder.org;
        this.token = builder.token;
        this.bucket = builder.bucket;
        this.measurement = builder.measurement;
        this.valueField = builder.valueField;
    }

    public String getUrl() { return url; }
    public String getOrg() { return org; }
    public String getToken() { return token; }
    public String getBucket() { return bucket; }
    public String getMeasurement() { return measurement; }
    public String getValueField() { return valueField; }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.INFLUXDB;
    }

    @Override
    public boolean isValid() {
        return !Strings.isNullOrEmpty(url) && !Strings.isNullOrEmpty(org)
            && !Strings.isNullOrEmpty(token) && !Strings.isNullOrEmpty(bucket);
    }

    public boolean isSecure() {
        return url != null && url.startsWith("https");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String url, org, token, bucket;
        private String measurement = DEFAULT_MEASUREMENT;
        private String valueField = DEFAULT_VALUE_FIELD;

        public Builder url(String url) { this.url = url; return this; }
        public Builder org(String org) { this.org = org; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder bucket(String bucket) { this.bucket = bucket; return this; }
        public Builder measurement(String measurement) { this.measurement = measurement; return this; }
        public Builder valueField(String valueField) { this.valueField = valueField; return this; }

        public InfluxDBConfiguration build() {
            return new InfluxDBConfiguration(this);
        }
    }
}
