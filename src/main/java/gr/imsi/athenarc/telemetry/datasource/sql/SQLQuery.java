package gr.imsi.athenarc.telemetry.datasource.sql;

import java.util.Arrays;
import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the values to bind to them, in order.
 */
public final class SQLQuery {

    private final String sql;
    private final List<Object> parameters;

    public SQLQuery(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = List.copyOf(parameters);
    }

    public SQLQuery(String sql, Object... parameters) {
        this(sql, Arrays.asList(parameters));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
