package gr.imsi.athenarc.telemetry.datasource.connection;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InfluxDBConnection implements DatabaseConnection {
    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBConnection.class);

    private final String url;
    private final String org;
    private final String token;
    private final String bucket;
    private InfluxDBClient client;

    public InfluxDBConnection(String url, String org, String token, String bucket) {
        this.url = url;
        this.org = org;
        this.token = token;
        this.bucket = bucket;
    }

    @Override
    public DatabaseConnection connect() {
        if (client == null) {
            client = InfluxDBClientFactory.create(url, token.toCharArray(), org, bucket);
            LOG.info("Initialized InfluxDB client for {} (org: {}, bucket: {})", url, org, bucket);
        }
        return this;
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    @Override
    public void closeConnection() {
        if (client != null) {
            client.close();
            client = null;
            LOG.debug("Closed InfluxDB client for {}", url);
        }
    }

    public InfluxDBClient getClient() {
        if (client == null) {
            connect();
        }
        return client;
    }

    public String getUrl() {
        return url;
    }

    public String getOrg() {
        return org;
    }

    public String getBucket() {
        return bucket;
    }

}
