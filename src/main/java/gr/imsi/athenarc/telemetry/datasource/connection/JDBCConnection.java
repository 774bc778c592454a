package gr.imsi.athenarc.telemetry.datasource.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSourceException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

public class JDBCConnection implements DatabaseConnection {
    private static final Logger LOG = LoggerFactory.getLogger(JDBCConnection.class);

    private final String url;
    private final String user;
    private final String password;
    private final Properties extraProperties;
    private Connection connection;

    public JDBCConnection(String url, String user, String password) {
        this(url, user, password, new Properties());
    }

    /**
     * @param extraProperties driver properties such as {@code ssl} or {@code connectTimeout},
     *                        passed through as given
     */
    public JDBCConnection(String url, String user, String password, Properties extraProperties) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.extraProperties = extraProperties;
    }

    @Override
    public DatabaseConnection connect() {
        try {
            Properties properties = new Properties();
            properties.putAll(extraProperties);
            if (user != null) {
                properties.setProperty("user", user);
            }
            if (password != null) {
                properties.setProperty("password", password);
            }
            connection = DriverManager.getConnection(url, properties);
            LOG.info("Initialized JDBC connection {}", url);
        } catch (SQLException e) {
            LOG.error("Could not open JDBC connection {}: {}", url, e.getMessage());
            throw new DataSourceException("Could not connect to " + url + ": " + e.getMessage(), e);
        }
        return this;
    }

    @Override
    public boolean isConnected() {
        try {
            return connection != null && !connection.isClosed();
        } catch (SQLException e) {
            LOG.warn("Could not check JDBC connection state: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.error(e.getClass().getName() + ": " + e.getMessage());
            throw new DataSourceException("Error closing connection", e);
        } finally {
            connection = null;
        }
    }

    public String getUrl() {
        return url;
    }

    public String getUser() {
        return user;
    }

    /**
     * Returns the open connection, opening it first if needed.
     */
    public Connection getConnection() {
        if (!isConnected()) {
            connect();
        }
        return connection;
    }

}
