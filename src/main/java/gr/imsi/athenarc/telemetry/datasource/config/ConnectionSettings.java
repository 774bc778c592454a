package gr.imsi.athenarc.telemetry.datasource.config;

/**
 * Connection fields shared by all backends, as stored. Secrets are kept in their at-rest form
 * and only decrypted when a data source is created.
 */
public class ConnectionSettings {

    private String host;
    private int port;
    private String username;
    private String encryptedPassword;
    private String databaseName;
    private boolean useSsl;
    private String connectionString;

    private String url;
    private String encryptedToken;
    private String org;
    private String bucket;
    private String measurement;
    private String valueField;

    private String apiUrl;
    private Integer connectionId;
    private int timeoutSeconds = ApiConfiguration.DEFAULT_TIMEOUT_SECONDS;

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getUsername() { return username; }
    public String getEncryptedPassword() { return encryptedPassword; }
    public String getDatabaseName() { return databaseName; }
    public boolean isUseSsl() { return useSsl; }
    public String getConnectionString() { return connectionString; }
    public String getUrl() { return url; }
    public String getEncryptedToken() { return encryptedToken; }
    public String getOrg() { return org; }
    public String getBucket() { return bucket; }
    public String getMeasurement() { return measurement; }
    public String getValueField() { return valueField; }
    public String getApiUrl() { return apiUrl; }
    public Integer getConnectionId() { return connectionId; }
    public int getTimeoutSeconds() { return timeoutSeconds; }

    public void setHost(String host) { this.host = host; }
    public void setPort(int port) { this.port = port; }
    public void setUsername(String username) { this.username = username; }
    public void setEncryptedPassword(String encryptedPassword) { this.encryptedPassword = encryptedPassword; }
    public void setDatabaseName(String databaseName) { this.databaseName = databaseName; }
    public void setUseSsl(boolean useSsl) { this.useSsl = useSsl; }
    public void setConnectionString(String connectionString) { this.connectionString = connectionString; }
    public void setUrl(String url) { this.url = url; }
    public void setEncryptedToken(String encryptedToken) { this.encryptedToken = encryptedToken; }
    public void setOrg(String org) { this.org = org; }
    public void setBucket(String bucket) { this.bucket = bucket; }
    public void setMeasurement(String measurement) { this.measurement = measurement; }
    public void setValueField(String valueField) { this.valueField = valueField; }
    public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    public void setConnectionId(Integer connectionId) { this.connectionId = connectionId; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}
