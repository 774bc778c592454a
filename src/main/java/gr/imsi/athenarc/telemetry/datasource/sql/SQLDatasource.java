package gr.imsi.athenarc.telemetry.datasource.sql;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.DataSourceException;
import gr.imsi.athenarc.telemetry.datasource.SupportsRawTableAccess;
import gr.imsi.athenarc.telemetry.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.telemetry.datasource.executor.SQLQueryExecutor;
import gr.imsi.athenarc.telemetry.datasource.iterator.SQLDataPointsIterator;
import gr.imsi.athenarc.telemetry.domain.*;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class SQLDatasource implements DataSource, SupportsRawTableAccess {

    private static final Logger LOG = LoggerFactory.getLogger(SQLDatasource.class);

    private final SQLQueryExecutor sqlQueryExecutor;
    private final SQLConfiguration configuration;
    private final SQLQueryBuilder queryBuilder;

    public SQLDatasource(SQLQueryExecutor sqlQueryExecutor, SQLConfiguration configuration, SQLQueryBuilder queryBuilder) {
        this.sqlQueryExecutor = Preconditions.checkNotNull(sqlQueryExecutor, "sqlQueryExecutor");
        this.configuration = Preconditions.checkNotNull(configuration, "configuration");
        this.queryBuilder = Preconditions.checkNotNull(queryBuilder, "queryBuilder");
    }

    @Override
    public ConnectionResult testConnection() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try (ResultSet resultSet = sqlQueryExecutor.executeDbQuery(queryBuilder.buildTestSQLQuery())) {
            String version = resultSet.next() ? Strings.nullToEmpty(resultSet.getString(1)) : "Unknown";
            Duration latency = stopwatch.elapsed();
            LOG.info("PostgreSQL connection test successful - Latency: {} ms", latency.toMillis());
            return ConnectionResult.success("PostgreSQL connection successful", latency, ImmutableMap.of(
                "Host", Strings.nullToEmpty(configuration.getHost()),
                "Port", String.valueOf(configuration.getPort()),
                "Database", Strings.nullToEmpty(configuration.getDatabaseName()),
                "Version", version));
        } catch (SQLException | RuntimeException e) {
            LOG.error("PostgreSQL connection test failed", e);
            return ConnectionResult.failure("Connection failed: " + e.getMessage(), e, stopwatch.elapsed());
        }
    }

    @NotNull
    @Override
    public List<DataPoint> queryData(QueryParams params) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkArgument(queryBuilder.validateParameters(params), INVALID_TIME_RANGE);
        SQLQuery query = queryBuilder.buildDataQuery(params, configuration.getTableSchema());
        List<DataPoint> dataPoints = new ArrayList<>();
        try (ResultSet resultSet = sqlQueryExecutor.executeDbQuery(query)) {
            SQLDataPointsIterator iterator = new SQLDataPointsIterator(resultSet);
            iterator.forEachRemaining(dataPoints::add);
        } catch (SQLException e) {
            throw new DataSourceException("Failed to query data: " + e.getMessage(), e);
        }
        LOG.info("Query returned {} data points", dataPoints.size());
        return dataPoints;
    }

    @Override
    public List<String> getAvailableSchemas() {
        return queryStrings(queryBuilder.buildSchemasQuery());
    }

    @Override
    public List<String> getTablesInSchema(String schemaName) {
        return queryStrings(queryBuilder.buildTablesQuery(schemaName));
    }

    @Override
    public TableSchema getTableSchema(String tableName, String schemaName) {
        List<String> columns = queryStrings(queryBuilder.buildColumnsQuery(tableName, schemaName));
        if (columns.isEmpty()) {
            LOG.warn("No columns found for table {}.{}, using default mapping", schemaName, tableName);
        }
        TableSchema schema = new TableSchema(schemaName, tableName, ColumnMapping.detect(columns));
        LOG.info("Detected table schema: {}", schema);
        return schema;
    }

    @Override
    public ConnectionInfo getConnectionInfo() {
        return ConnectionInfo.builder(DatabaseType.POSTGRESQL)
            .host(configuration.getHost())
            .databaseName(configuration.getDatabaseName())
            .username(configuration.getUsername())
            .secure(configuration.isUseSsl())
            .build();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    public void close() {
        sqlQueryExecutor.closeConnection();
    }

    public SQLConfiguration getConfiguration() {
        return configuration;
    }

    private List<String> queryStrings(SQLQuery query) {
        List<String> values = new ArrayList<>();
        try (ResultSet resultSet = sqlQueryExecutor.executeDbQuery(query)) {
            while (resultSet.next()) {
                values.add(resultSet.getString(1));
            }
        } catch (SQLException e) {
            throw new DataSourceException("Failed to read " + query.getSql() + ": " + e.getMessage(), e);
        }
        return values;
    }
}
