package gr.imsi.athenarc.telemetry.datasource;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.api.AggregatesApiDatasource;
import gr.imsi.athenarc.telemetry.datasource.api.HistorianApiDatasource;
import gr.imsi.athenarc.telemetry.datasource.config.ApiConfiguration;
import gr.imsi.athenarc.telemetry.datasource.config.ConnectionSettings;
import gr.imsi.athenarc.telemetry.datasource.config.DatabaseConfig;
import gr.imsi.athenarc.telemetry.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.telemetry.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.telemetry.datasource.connection.ApiConnection;
import gr.imsi.athenarc.telemetry.datasource.connection.InfluxDBConnection;
import gr.imsi.athenarc.telemetry.datasource.connection.JDBCConnection;
import gr.imsi.athenarc.telemetry.datasource.executor.InfluxDBQueryExecutor;
import gr.imsi.athenarc.telemetry.datasource.executor.SQLQueryExecutor;
import gr.imsi.athenarc.telemetry.datasource.influx.InfluxDBDatasource;
import gr.imsi.athenarc.telemetry.datasource.influx.InfluxDBQueryBuilder;
import gr.imsi.athenarc.telemetry.datasource.influx.InfluxDBResponseParser;
import gr.imsi.athenarc.telemetry.datasource.sql.SQLDatasource;
import gr.imsi.athenarc.telemetry.datasource.sql.SQLQueryBuilder;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.TableSchema;
import gr.imsi.athenarc.telemetry.security.CredentialEncryptor;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a {@link DatabaseConfig} into a live {@link DataSource}. The caller owns the returned
 * data source and must close it.
 */
public class DataSourceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DataSourceFactory.class);

    public static final String DEFAULT_INFLUX_URL = "http://localhost:8086";

    private final CredentialEncryptor encryptor;
    private final Map<DatabaseType, Function<DatabaseConfig, DataSource>> creators = new EnumMap<>(DatabaseType.class);

    public DataSourceFactory(CredentialEncryptor encryptor) {
        this.encryptor = Preconditions.checkNotNull(encryptor, "encryptor");
        creators.put(DatabaseType.INFLUXDB, this::createInfluxDBDataSource);
        creators.put(DatabaseType.POSTGRESQL, this::createSQLDataSource);
        creators.put(DatabaseType.HISTORIAN_API, config -> new HistorianApiDatasource(
            createApiConnection(config), createApiConfiguration(config)));
        creators.put(DatabaseType.AGGREGATES_API, config -> new AggregatesApiDatasource(
            createApiConnection(config), createApiConfiguration(config)));
    }

    public DataSource createDataSource(DatabaseConfig config) {
        Preconditions.checkNotNull(config, "config");
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid configuration for " + config.getDatabaseType()
                + ": check that all required connection fields are set");
        }
        Function<DatabaseConfig, DataSource> creator = creators.get(config.getDatabaseType());
        if (creator == null) {
            throw new UnsupportedOperationException("Database type " + config.getDatabaseType()
                + " is not implemented. Supported types are: " + supportedTypesList());
        }
        LOG.info("Creating data source for {}", config.getDatabaseType().getDisplayName());
        return creator.apply(config);
    }

    /**
     * A starting configuration for the given backend with local defaults and no secrets.
     */
    public DatabaseConfig createDefaultConfig(DatabaseType type) {
        Preconditions.checkNotNull(type, "type");
        ConnectionSettings settings = new ConnectionSettings();
        DatabaseConfig config = new DatabaseConfig(type, settings);
        if (type.isRelational()) {
            settings.setHost("localhost");
            settings.setPort(type.getDefaultPort());
            settings.setDatabaseName(type == DatabaseType.POSTGRESQL ? "postgres" : "");
            settings.setUsername("");
            settings.setEncryptedPassword("");
            config.setTableSchema(new TableSchema(TableSchema.DEFAULT_SCHEMA, null, null));
        } else {
            settings.setUrl(DEFAULT_INFLUX_URL);
            settings.setEncryptedToken("");
            settings.setMeasurement(type == DatabaseType.AGGREGATES_API
                ? ApiConfiguration.DEFAULT_AGGREGATES_MEASUREMENT : InfluxDBConfiguration.DEFAULT_MEASUREMENT);
            if (type.isApi()) {
                settings.setApiUrl(ApiConfiguration.DEFAULT_API_URL);
                settings.setTimeoutSeconds(ApiConfiguration.DEFAULT_TIMEOUT_SECONDS);
            }
        }
        LOG.debug("Created default configuration for {}", type);
        return config;
    }

    public boolean isSupported(DatabaseType type) {
        return type != null && creators.containsKey(type);
    }

    public Set<DatabaseType> getSupportedTypes() {
        return creators.keySet();
    }

    private String supportedTypesList() {
        return creators.keySet().stream().map(Enum::name).collect(Collectors.joining(", "));
    }

    private DataSource createInfluxDBDataSource(DatabaseConfig config) {
        ConnectionSettings settings = config.getConnectionSettings();
        InfluxDBConfiguration influxConfig = InfluxDBConfiguration.builder()
            .url(settings.getUrl())
            .org(settings.getOrg())
            .token(decrypt(settings.getEncryptedToken()))
            .bucket(settings.getBucket())
            .measurement(Strings.isNullOrEmpty(settings.getMeasurement())
                ? InfluxDBConfiguration.DEFAULT_MEASUREMENT : settings.getMeasurement())
            .valueField(Strings.isNullOrEmpty(settings.getValueField())
                ? InfluxDBConfiguration.DEFAULT_VALUE_FIELD : settings.getValueField())
            .build();
        InfluxDBConnection connection = (InfluxDBConnection) new InfluxDBConnection(
            influxConfig.getUrl(),
            influxConfig.getOrg(),
            influxConfig.getToken(),
            influxConfig.getBucket()
        ).connect();
        InfluxDBQueryExecutor executor = new InfluxDBQueryExecutor(connection);
        InfluxDBQueryBuilder queryBuilder = new InfluxDBQueryBuilder(influxConfig.getBucket(),
            influxConfig.getMeasurement(), influxConfig.getValueField());
        return new InfluxDBDatasource(executor, influxConfig, queryBuilder, new InfluxDBResponseParser());
    }

    private DataSource createSQLDataSource(DatabaseConfig config) {
        ConnectionSettings settings = config.getConnectionSettings();
        SQLConfiguration.Builder builder = SQLConfiguration.builder()
            .host(settings.getHost())
            .port(settings.getPort())
            .databaseName(settings.getDatabaseName())
            .username(settings.getUsername())
            .password(decrypt(settings.getEncryptedPassword()))
            .useSsl(settings.isUseSsl())
            .tableSchema(config.getTableSchema());
        if (!Strings.isNullOrEmpty(settings.getConnectionString())) {
            builder.url(settings.getConnectionString());
        }
        SQLConfiguration sqlConfig = builder.build();

        Properties properties = new Properties();
        properties.setProperty("ssl", String.valueOf(sqlConfig.isUseSsl()));
        properties.setProperty("connectTimeout", String.valueOf(sqlConfig.getConnectTimeoutSeconds()));
        properties.setProperty("socketTimeout", String.valueOf(sqlConfig.getSocketTimeoutSeconds()));
        JDBCConnection jdbcConnection = new JDBCConnection(sqlConfig.getJdbcUrl(),
            sqlConfig.getUsername(), sqlConfig.getPassword(), properties);
        SQLQueryExecutor executor = new SQLQueryExecutor(jdbcConnection);
        return new SQLDatasource(executor, sqlConfig, new SQLQueryBuilder());
    }

    private ApiConnection createApiConnection(DatabaseConfig config) {
        ConnectionSettings settings = config.getConnectionSettings();
        String apiUrl = Strings.isNullOrEmpty(settings.getApiUrl()) ? ApiConfiguration.DEFAULT_API_URL : settings.getApiUrl();
        int timeout = settings.getTimeoutSeconds() > 0 ? settings.getTimeoutSeconds() : ApiConfiguration.DEFAULT_TIMEOUT_SECONDS;
        return (ApiConnection) new ApiConnection(apiUrl, timeout).connect();
    }

    /**
     * The API forwards the InfluxDB credentials, so the InfluxDB url of the settings is split
     * into host and port.
     */
    ApiConfiguration createApiConfiguration(DatabaseConfig config) {
        ConnectionSettings settings = config.getConnectionSettings();
        String url = Strings.isNullOrEmpty(settings.getUrl()) ? DEFAULT_INFLUX_URL : settings.getUrl();
        ApiConfiguration.Builder builder = ApiConfiguration.builder(config.getDatabaseType())
            .influxHost(extractHost(url))
            .influxPort(extractPort(url, DatabaseType.INFLUXDB.getDefaultPort()))
            .org(settings.getOrg())
            .bucket(settings.getBucket())
            .token(decrypt(settings.getEncryptedToken()))
            .connectionId(settings.getConnectionId());
        if (!Strings.isNullOrEmpty(settings.getApiUrl())) {
            builder.apiUrl(settings.getApiUrl());
        }
        if (!Strings.isNullOrEmpty(settings.getMeasurement())) {
            builder.measurement(settings.getMeasurement());
        }
        if (settings.getTimeoutSeconds() > 0) {
            builder.timeoutSeconds(settings.getTimeoutSeconds());
        }
        return builder.build();
    }

    private String decrypt(String value) {
        if (Strings.isNullOrEmpty(value)) {
            return value;
        }
        return encryptor.decrypt(value);
    }

    static String extractHost(String url) {
        if (Strings.isNullOrEmpty(url)) {
            return "localhost";
        }
        try {
            String host = new URI(url).getHost();
            if (host != null) {
                return host;
            }
        } catch (URISyntaxException e) {
            LOG.debug("Not a valid URI, reading host from '{}' directly", url);
        }
        // bare "host" or "host:port"
        return url.split(":")[0];
    }

    static int extractPort(String url, int defaultPort) {
        if (Strings.isNullOrEmpty(url)) {
            return defaultPort;
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() != null) {
                return uri.getPort() > 0 ? uri.getPort() : defaultPort;
            }
        } catch (URISyntaxException e) {
            LOG.debug("Not a valid URI, reading port from '{}' directly", url);
        }
        String[] parts = url.split(":");
        if (parts.length > 1) {
            try {
                return Integer.parseInt(parts[parts.length - 1]);
            } catch (NumberFormatException e) {
                return defaultPort;
            }
        }
        return defaultPort;
    }
}
