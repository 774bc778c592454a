package gr.imsi.athenarc.telemetry.datasource.iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSourceException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;

public abstract class SQLIterator<T> implements Iterator<T> {
    protected static final Logger LOG = LoggerFactory.getLogger(SQLIterator.class);

    protected final ResultSet resultSet;
    protected boolean hasNextCached = false;
    protected boolean nextExists = false;

    protected SQLIterator(ResultSet resultSet) {
        if (resultSet == null) {
            throw new IllegalArgumentException("ResultSet cannot be null");
        }
        this.resultSet = resultSet;
    }

    @Override
    public boolean hasNext() {
        if (!hasNextCached) {
            try {
                nextExists = resultSet.next();
                hasNextCached = true;
            } catch (SQLException e) {
                LOG.error("Error checking for next result", e);
                throw new DataSourceException("Error reading result set", e);
            }
        }
        return nextExists;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements to iterate over");
        }

        hasNextCached = false;
        try {
            return getNext();
        } catch (SQLException e) {
            LOG.error("Error reading result set", e);
            throw new DataSourceException("Error reading result set", e);
        }
    }

    /**
     * Reads a timestamp column, or null if the value is SQL NULL.
     */
    protected Instant getInstant(String columnName) throws SQLException {
        try {
            OffsetDateTime dateTime = resultSet.getObject(columnName, OffsetDateTime.class);
            if (dateTime != null) {
                return dateTime.toInstant();
            }
        } catch (SQLException e) {
            LOG.debug("Column {} not readable as OffsetDateTime, falling back to Timestamp: {}", columnName, e.getMessage());
        }
        Timestamp timestamp = resultSet.getTimestamp(columnName);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    protected String getSafeStringValue(String columnName) throws SQLException {
        String value = resultSet.getString(columnName);
        return value == null ? "" : value;
    }

    protected abstract T getNext() throws SQLException;
}
