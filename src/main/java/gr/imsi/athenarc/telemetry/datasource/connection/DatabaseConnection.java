package gr.imsi.athenarc.telemetry.datasource.connection;

/**
 * Owns the client or connection handle of one backend.
 */
public interface DatabaseConnection {

    public DatabaseConnection connect();

    public boolean isConnected();

    public void closeConnection();

}
