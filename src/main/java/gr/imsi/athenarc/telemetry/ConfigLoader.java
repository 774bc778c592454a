package gr.imsi.athenarc.telemetry;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.config.ConnectionSettings;
import gr.imsi.athenarc.telemetry.datasource.config.DatabaseConfig;
import gr.imsi.athenarc.telemetry.domain.ColumnMapping;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads connection settings from {@code application.properties} style files.
 * <p>
 * InfluxDB and both API backends read {@code influxdb.*}, the API backends add {@code api.*},
 * PostgreSQL reads {@code postgres.*}. Secrets are copied as they are into the
 * {@code encrypted*} fields and go through the factory's encryptor later.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String TYPE_KEY = "datasource.type";

    private ConfigLoader() {}

    /**
     * Loads {@code /application.properties} from the classpath.
     * @return the properties, or null if the resource is missing or unreadable
     */
    public static Properties readProperties() {
        Properties properties = new Properties();
        try (InputStream input = ConfigLoader.class.getResourceAsStream("/application.properties")) {
            if (input == null) {
                LOG.error("Unable to find application.properties in resources.");
                return null;
            }
            properties.load(input);
        } catch (IOException ex) {
            LOG.error("Unable to read application.properties", ex);
            return null;
        }
        return properties;
    }

    /**
     * Read properties from a specific file
     * @param filePath Path to the properties file
     * @return Properties object or null if file cannot be read
     */
    public static Properties readPropertiesFromFile(String filePath) {
        Properties properties = new Properties();
        try (FileReader reader = new FileReader(filePath)) {
            properties.load(reader);
            LOG.info("Successfully loaded configuration from: {}", filePath);
            return properties;
        } catch (IOException ex) {
            LOG.error("Unable to read configuration file: {}", filePath, ex);
            return null;
        }
    }

    /**
     * @return the backend named by {@code datasource.type}, or {@code fallback} when it is unset
     */
    public static DatabaseType readDatabaseType(Properties properties, DatabaseType fallback) {
        String type = properties.getProperty(TYPE_KEY);
        if (type == null || type.isBlank()) {
            return fallback;
        }
        return DatabaseType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    }

    public static DatabaseConfig toDatabaseConfig(DatabaseType type, Properties properties) {
        Preconditions.checkNotNull(type, "type");
        Preconditions.checkNotNull(properties, "properties");
        ConnectionSettings settings = new ConnectionSettings();
        DatabaseConfig config = new DatabaseConfig(type, settings);
        switch (type) {
            case INFLUXDB:
                readInfluxSettings(settings, properties);
                break;
            case HISTORIAN_API:
            case AGGREGATES_API:
                readInfluxSettings(settings, properties);
                // the InfluxDB measurement is the raw one, the API types pick their own default
                settings.setMeasurement(trimToNull(properties.getProperty("api.measurement")));
                settings.setApiUrl(trimToNull(properties.getProperty("api.url")));
                settings.setTimeoutSeconds(readInt(properties, "api.timeoutSeconds", 0));
                String connectionId = trimToNull(properties.getProperty("api.connectionId"));
                settings.setConnectionId(connectionId == null ? null : Integer.valueOf(connectionId));
                break;
            case POSTGRESQL:
                readPostgresSettings(config, settings, properties);
                break;
            default:
                throw new UnsupportedOperationException("No configuration keys defined for database type " + type);
        }
        LOG.debug("Loaded {}", config);
        return config;
    }

    private static void readInfluxSettings(ConnectionSettings settings, Properties properties) {
        settings.setUrl(trimToNull(properties.getProperty("influxdb.url")));
        settings.setOrg(trimToNull(properties.getProperty("influxdb.org")));
        settings.setBucket(trimToNull(properties.getProperty("influxdb.bucket")));
        settings.setEncryptedToken(trimToNull(properties.getProperty("influxdb.token")));
        settings.setMeasurement(trimToNull(properties.getProperty("influxdb.measurement")));
        settings.setValueField(trimToNull(properties.getProperty("influxdb.valueField")));
    }

    private static void readPostgresSettings(DatabaseConfig config, ConnectionSettings settings, Properties properties) {
        settings.setConnectionString(trimToNull(properties.getProperty("postgres.url")));
        settings.setHost(trimToNull(properties.getProperty("postgres.host")));
        settings.setPort(readInt(properties, "postgres.port", DatabaseType.POSTGRESQL.getDefaultPort()));
        settings.setDatabaseName(trimToNull(properties.getProperty("postgres.database")));
        settings.setUsername(trimToNull(properties.getProperty("postgres.username")));
        settings.setEncryptedPassword(trimToNull(properties.getProperty("postgres.password")));
        settings.setUseSsl(Boolean.parseBoolean(properties.getProperty("postgres.ssl", "false").trim()));

        ColumnMapping mapping = new ColumnMapping();
        String timeColumn = trimToNull(properties.getProperty("postgres.timeColumn"));
        if (timeColumn != null) {
            mapping.setTimeColumn(timeColumn);
        }
        String valueColumn = trimToNull(properties.getProperty("postgres.valueColumn"));
        if (valueColumn != null) {
            mapping.setValueColumn(valueColumn);
        }
        config.setTableSchema(new TableSchema(trimToNull(properties.getProperty("postgres.schema")),
            trimToNull(properties.getProperty("postgres.table")), mapping));
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, was '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        return Strings.emptyToNull(value == null ? null : value.trim());
    }
}
