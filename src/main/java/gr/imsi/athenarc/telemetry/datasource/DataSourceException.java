package gr.imsi.athenarc.telemetry.datasource;

/**
 * Thrown when a backend query cannot be executed or its response cannot be read.
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
