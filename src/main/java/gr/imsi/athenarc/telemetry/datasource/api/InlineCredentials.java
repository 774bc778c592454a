package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * InfluxDB credentials sent with a request instead of a managed connection id.
 */
public class InlineCredentials {

    @JsonProperty("host")
    private String host;

    @JsonProperty("port")
    private int port;

    @JsonProperty("org")
    private String org;

    @JsonProperty("bucket")
    private String bucket;

    @JsonProperty("token")
    private String token;

    public InlineCredentials() {}

    public InlineCredentials(String host, int port, String org, String bucket, String token) {
        this.host = host;
        this.port = port;
        this.org = org;
        this.bucket = bucket;
        this.token = token;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getOrg() { return org; }
    public String getBucket() { return bucket; }
    public String getToken() { return token; }
}
