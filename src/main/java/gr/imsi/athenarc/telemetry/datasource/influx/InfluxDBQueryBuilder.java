package gr.imsi.athenarc.telemetry.datasource.influx;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.QueryBuilder;
import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.DateTimeUtil;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;
import gr.imsi.athenarc.telemetry.domain.IdFilter;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds Flux queries over one measurement of a bucket. Hierarchy IDs only ever appear as
 * escaped string literals inside equality comparisons, window periods must be Flux duration
 * literals.
 */
public class InfluxDBQueryBuilder implements QueryBuilder<String> {

    private static final Pattern DURATION_LITERAL = Pattern.compile("(\\d+(ns|us|ms|s|m|h|d|w|mo|y))+");

    private final String bucket;
    private final String measurement;
    private final String valueField;

    public InfluxDBQueryBuilder(String bucket, String measurement, String valueField) {
        this.bucket = Preconditions.checkNotNull(bucket, "bucket");
        this.measurement = Preconditions.checkNotNull(measurement, "measurement");
        this.valueField = Preconditions.checkNotNull(valueField, "valueField");
    }

    @Override
    public String buildTestQuery() {
        return "from(bucket: " + stringLiteral(bucket) + ")\n" +
            "  |> range(start: -1m)\n" +
            "  |> limit(n: 1)\n";
    }

    /**
     * Raw readings, flattened into a single table and sorted most recent first so that the
     * limit applies across all series.
     */
    @Override
    public String buildDataQuery(QueryParams params, TableSchema schema) {
        checkParameters(params);
        StringBuilder query = new StringBuilder();
        appendSource(query, params);
        appendHierarchyFilters(query, params);
        query.append("  |> group()\n");
        query.append("  |> sort(columns: [\"_time\"], desc: true)\n");
        if (params.getLimit() != null) {
            query.append("  |> limit(n: ").append(params.getLimit()).append(")\n");
        }
        return query.toString();
    }

    /**
     * Per-series windowed aggregate of the value field, cast to float first, then flattened and
     * sorted most recent first.
     * @param windowPeriod a Flux duration such as {@code 5m}
     */
    public String buildAggregatedQuery(QueryParams params, AggregationType aggregationType, String windowPeriod) {
        checkParameters(params);
        Preconditions.checkNotNull(aggregationType, "aggregationType");
        Preconditions.checkArgument(windowPeriod != null && DURATION_LITERAL.matcher(windowPeriod).matches(),
            "Invalid window period: %s", windowPeriod);

        StringBuilder query = new StringBuilder();
        appendSource(query, params);
        appendHierarchyFilters(query, params);
        query.append("  |> filter(fn: (r) => r[\"_field\"] == ").append(stringLiteral(valueField)).append(")\n");
        query.append("  |> map(fn: (r) => ({ r with _value: float(v: r._value) }))\n");
        query.append("  |> aggregateWindow(every: ").append(windowPeriod)
            .append(", fn: ").append(aggregationType.fluxFunction())
            .append(", createEmpty: false)\n");
        query.append("  |> group()\n");
        query.append("  |> sort(columns: [\"_time\"], desc: true)\n");
        return query.toString();
    }

    /**
     * Lists the distinct IDs of one level seen within the lookback period.
     * @param parentIds ID filters of other levels to restrict to, comma-separated lists allowed;
     *                  blank entries are ignored
     */
    public String buildDistinctValuesQuery(HierarchyLevel level, Map<HierarchyLevel, String> parentIds, Duration lookback) {
        Preconditions.checkNotNull(level, "level");
        Preconditions.checkArgument(lookback != null && !lookback.isNegative() && !lookback.isZero(),
            "lookback must be positive");
        String column = level.getDefaultColumn();
        StringBuilder query = new StringBuilder();
        query.append("from(bucket: ").append(stringLiteral(bucket)).append(")\n");
        query.append("  |> range(start: -").append(relativeDuration(lookback)).append(")\n");
        query.append("  |> filter(fn: (r) => r[\"_measurement\"] == ").append(stringLiteral(measurement)).append(")\n");
        if (parentIds != null) {
            for (Map.Entry<HierarchyLevel, String> parent : parentIds.entrySet()) {
                if (IdFilter.isUnrestricted(parent.getValue())) {
                    continue;
                }
                query.append("  |> filter(fn: (r) => ")
                    .append(buildMultiValueFilter(parent.getKey().getDefaultColumn(), parent.getValue()))
                    .append(")\n");
            }
        }
        query.append("  |> keep(columns: [").append(stringLiteral(column)).append("])\n");
        query.append("  |> group()\n");
        query.append("  |> distinct(column: ").append(stringLiteral(column)).append(")\n");
        return query.toString();
    }

    /**
     * Compiles a comma-separated ID list into a Flux predicate: an OR of equalities, a single
     * equality, or {@code true} when the list is empty.
     */
    public static String buildMultiValueFilter(String column, String filter) {
        List<String> values = IdFilter.split(filter);
        if (values.isEmpty()) {
            return "true";
        }
        return values.stream()
            .map(value -> "r[" + stringLiteral(column) + "] == " + stringLiteral(value))
            .collect(Collectors.joining(" or "));
    }

    // Whole hours stay in hours, anything finer goes out in seconds
    static String relativeDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds > 0 && seconds % 3600 == 0) {
            return (seconds / 3600) + "h";
        }
        return Math.max(seconds, 1) + "s";
    }

    /** Quotes and escapes a Flux string literal. */
    static String stringLiteral(String value) {
        StringBuilder literal = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                literal.append('\\').append(c);
            } else if (c == '$' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
                // "${" opens an interpolation
                literal.append("\\$");
            } else if (c == '\n') {
                literal.append("\\n");
            } else if (c == '\r') {
                literal.append("\\r");
            } else if (c == '\t') {
                literal.append("\\t");
            } else {
                literal.append(c);
            }
        }
        return literal.append('"').toString();
    }

    private void checkParameters(QueryParams params) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkArgument(validateParameters(params), DataSource.INVALID_TIME_RANGE);
    }

    private void appendSource(StringBuilder query, QueryParams params) {
        query.append("from(bucket: ").append(stringLiteral(bucket)).append(")\n");
        query.append("  |> range(start: ").append(DateTimeUtil.formatRfc3339(params.getStartTime()))
            .append(", stop: ").append(DateTimeUtil.formatRfc3339(params.getEndTime())).append(")\n");
        query.append("  |> filter(fn: (r) => r[\"_measurement\"] == ").append(stringLiteral(measurement)).append(")\n");
        query.append("  |> filter(fn: (r) => ");
        HierarchyLevel[] levels = HierarchyLevel.values();
        for (int i = 0; i < levels.length; i++) {
            if (i > 0) {
                query.append(" and ");
            }
            query.append("exists r[").append(stringLiteral(levels[i].getDefaultColumn())).append("]");
        }
        query.append(")\n");
    }

    private void appendHierarchyFilters(StringBuilder query, QueryParams params) {
        for (HierarchyLevel level : HierarchyLevel.values()) {
            String filter = params.getFilter(level);
            if (IdFilter.isUnrestricted(filter)) {
                continue;
            }
            query.append("  |> filter(fn: (r) => ")
                .append(buildMultiValueFilter(level.getDefaultColumn(), filter))
                .append(")\n");
        }
    }

    public String getBucket() {
        return bucket;
    }

    public String getMeasurement() {
        return measurement;
    }
}
