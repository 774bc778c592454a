package gr.imsi.athenarc.telemetry.datasource.sql;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.QueryBuilder;
import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.ColumnMapping;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;
import gr.imsi.athenarc.telemetry.domain.IdFilter;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds PostgreSQL queries against a table described by a {@link TableSchema}. Every value
 * coming from query parameters is bound; identifiers from the schema are quoted.
 * <p>
 * Result columns are aliased to {@code time}, {@code value} and the default hierarchy column
 * names so rows can be read the same way whatever the physical layout.
 */
public class SQLQueryBuilder implements QueryBuilder<SQLQuery> {

    private static final Pattern WINDOW_PERIOD = Pattern.compile("(\\d+)([a-zA-Z]*)");
    private static final List<String> SYSTEM_SCHEMAS = List.of("pg_catalog", "information_schema", "pg_toast");

    @Override
    public String buildTestQuery() {
        return "SELECT version()";
    }

    public SQLQuery buildTestSQLQuery() {
        return new SQLQuery(buildTestQuery(), Collections.emptyList());
    }

    @Override
    public SQLQuery buildDataQuery(QueryParams params, TableSchema schema) {
        checkParameters(params);
        ColumnMapping columns = checkSchema(schema).getColumnMapping();
        String timeColumn = quoteIdentifier(columns.getTimeColumn());
        List<Object> parameters = new ArrayList<>();

        StringBuilder sql = new StringBuilder("SELECT ")
            .append(timeColumn).append(" AS time, ")
            .append(quoteIdentifier(columns.getValueColumn())).append(" AS value, ")
            .append(levelSelectList(columns))
            .append(" FROM ").append(quoteTable(schema));
        appendWhere(sql, parameters, params, columns);
        sql.append(" ORDER BY ").append(timeColumn).append(" DESC");
        if (params.getLimit() != null) {
            sql.append(" LIMIT ?");
            parameters.add(params.getLimit());
        }
        return new SQLQuery(sql.toString(), parameters);
    }

    /**
     * Bucketed aggregate over the time column using TimescaleDB's {@code time_bucket}, grouped
     * by bucket and all hierarchy levels, most recent bucket first.
     */
    public SQLQuery buildAggregatedQuery(QueryParams params, TableSchema schema,
                                         AggregationType aggregationType, String windowPeriod) {
        checkParameters(params);
        Preconditions.checkNotNull(aggregationType, "aggregationType");
        ColumnMapping columns = checkSchema(schema).getColumnMapping();
        String timeColumn = quoteIdentifier(columns.getTimeColumn());
        List<Object> parameters = new ArrayList<>();

        StringBuilder sql = new StringBuilder("SELECT time_bucket(CAST(? AS INTERVAL), ")
            .append(timeColumn).append(") AS time, ")
            .append(aggregateExpression(aggregationType, columns)).append(" AS value, ")
            .append(levelSelectList(columns))
            .append(" FROM ").append(quoteTable(schema));
        parameters.add(toIntervalLiteral(windowPeriod));
        appendWhere(sql, parameters, params, columns);
        // ordinals, so a physical column named "time" cannot shadow the bucket alias
        sql.append(" GROUP BY 1, 3, 4, 5, 6 ORDER BY 1 DESC");
        return new SQLQuery(sql.toString(), parameters);
    }

    public SQLQuery buildSchemasQuery() {
        return new SQLQuery("SELECT schema_name FROM information_schema.schemata"
            + " WHERE schema_name NOT IN (?, ?, ?) ORDER BY schema_name", new ArrayList<>(SYSTEM_SCHEMAS));
    }

    public SQLQuery buildTablesQuery(String schemaName) {
        return new SQLQuery("SELECT table_name FROM information_schema.tables"
            + " WHERE table_schema = ? AND table_type = 'BASE TABLE' ORDER BY table_name", schemaOrDefault(schemaName));
    }

    public SQLQuery buildColumnsQuery(String tableName, String schemaName) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(tableName), "tableName is required");
        return new SQLQuery("SELECT column_name FROM information_schema.columns"
            + " WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position",
            schemaOrDefault(schemaName), tableName);
    }

    /**
     * Translates a short window period into a PostgreSQL interval literal:
     * {@code 5m} becomes {@code 5 minutes}, {@code 1h} becomes {@code 1 hour}. Unknown units are
     * read as minutes; empty or malformed input gives {@code 1 minute}.
     */
    public static String toIntervalLiteral(String windowPeriod) {
        if (windowPeriod == null) {
            return "1 minute";
        }
        Matcher matcher = WINDOW_PERIOD.matcher(windowPeriod.trim());
        if (!matcher.matches()) {
            return "1 minute";
        }
        String number = matcher.group(1);
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        String unitWord;
        switch (unit.isEmpty() ? 'm' : unit.charAt(0)) {
            case 's':
                unitWord = "second";
                break;
            case 'h':
                unitWord = "hour";
                break;
            case 'd':
                unitWord = "day";
                break;
            default:
                unitWord = "minute";
        }
        return number + " " + unitWord + ("1".equals(number) ? "" : "s");
    }

    static String aggregateExpression(AggregationType aggregationType, ColumnMapping columns) {
        String value = quoteIdentifier(columns.getValueColumn());
        String time = quoteIdentifier(columns.getTimeColumn());
        switch (aggregationType) {
            case MEAN:
                return "AVG(" + value + ")";
            case MIN:
                return "MIN(" + value + ")";
            case MAX:
                return "MAX(" + value + ")";
            case COUNT:
                return "COUNT(" + value + ")";
            case SUM:
                return "SUM(" + value + ")";
            case STDDEV:
                return "STDDEV(" + value + ")";
            case FIRST:
                return "first(" + value + ", " + time + ")";
            case LAST:
                return "last(" + value + ", " + time + ")";
            default:
                throw new IllegalArgumentException("Unsupported aggregation type: " + aggregationType);
        }
    }

    static String quoteIdentifier(String identifier) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(identifier), "identifier is required");
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static String quoteTable(TableSchema schema) {
        return quoteIdentifier(schemaOrDefault(schema.getSchemaName())) + "." + quoteIdentifier(schema.getTableName());
    }

    private static String schemaOrDefault(String schemaName) {
        return Strings.isNullOrEmpty(schemaName) || schemaName.isBlank() ? TableSchema.DEFAULT_SCHEMA : schemaName;
    }

    private static String levelSelectList(ColumnMapping columns) {
        StringBuilder select = new StringBuilder();
        for (HierarchyLevel level : HierarchyLevel.values()) {
            if (select.length() > 0) {
                select.append(", ");
            }
            select.append(quoteIdentifier(columns.getLevelColumn(level)))
                .append(" AS ").append(level.getDefaultColumn());
        }
        return select.toString();
    }

    private static void appendWhere(StringBuilder sql, List<Object> parameters, QueryParams params, ColumnMapping columns) {
        sql.append(" WHERE ").append(quoteIdentifier(columns.getTimeColumn())).append(" BETWEEN ? AND ?");
        parameters.add(Timestamp.from(params.getStartTime()));
        parameters.add(Timestamp.from(params.getEndTime()));
        for (HierarchyLevel level : HierarchyLevel.values()) {
            List<String> ids = IdFilter.split(params.getFilter(level));
            if (ids.isEmpty()) {
                continue;
            }
            // IDs are opaque strings, compare as text whatever the column type
            sql.append(" AND (CAST(").append(quoteIdentifier(columns.getLevelColumn(level))).append(" AS TEXT)");
            if (ids.size() == 1) {
                sql.append(" = ?)");
            } else {
                sql.append(" IN (").append(String.join(", ", Collections.nCopies(ids.size(), "?"))).append("))");
            }
            parameters.addAll(ids);
        }
    }

    private void checkParameters(QueryParams params) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkArgument(validateParameters(params), DataSource.INVALID_TIME_RANGE);
    }

    private static TableSchema checkSchema(TableSchema schema) {
        Preconditions.checkNotNull(schema, "schema");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(schema.getTableName()), "schema has no table name");
        return schema;
    }
}
