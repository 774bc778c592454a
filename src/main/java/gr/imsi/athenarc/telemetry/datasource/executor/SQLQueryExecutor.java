package gr.imsi.athenarc.telemetry.datasource.executor;

import gr.imsi.athenarc.telemetry.datasource.DataSourceException;
import gr.imsi.athenarc.telemetry.datasource.connection.JDBCConnection;
import gr.imsi.athenarc.telemetry.datasource.sql.SQLQuery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Executes parameterized SQL. Parameters are always bound, never concatenated into the text.
 */
public class SQLQueryExecutor implements QueryExecutor<SQLQuery, ResultSet> {

    private static final Logger LOG = LoggerFactory.getLogger(SQLQueryExecutor.class);

    private final JDBCConnection databaseConnection;

    public SQLQueryExecutor(JDBCConnection databaseConnection) {
        this.databaseConnection = databaseConnection;
    }

    /**
     * Runs the query and returns its result set. The statement closes together with the
     * result set, so callers only need to close the latter.
     */
    @Override
    public ResultSet executeDbQuery(SQLQuery query) {
        LOG.info("Executing Query: \n" + query.getSql());
        LOG.debug("Parameters: {}", query.getParameters());
        PreparedStatement statement = null;
        try {
            statement = databaseConnection.getConnection().prepareStatement(query.getSql());
            List<Object> parameters = query.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
            ResultSet resultSet = statement.executeQuery();
            statement.closeOnCompletion();
            return resultSet;
        } catch (SQLException e) {
            closeQuietly(statement, e);
            throw new DataSourceException("Error executing query: " + query.getSql(), e);
        }
    }

    private static void closeQuietly(PreparedStatement statement, SQLException failure) {
        if (statement == null) {
            return;
        }
        try {
            statement.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void closeConnection() {
        databaseConnection.closeConnection();
    }

    public JDBCConnection getConnection() {
        return databaseConnection;
    }

}
