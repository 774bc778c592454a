package gr.imsi.athenarc.telemetry.datasource.sql;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.ColumnMapping;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TableSchema;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SQLQueryBuilderTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T00:00:00Z");

    private final SQLQueryBuilder builder = new SQLQueryBuilder();
    private final TableSchema schema = new TableSchema("public", "readings", new ColumnMapping());

    @Test
    public void testDataQueryBindsEverything() {
        QueryParams params = QueryParams.builder()
            .startTime(START).endTime(END)
            .collectorId("1")
            .tagId("10, 20,30")
            .limit(500)
            .build();

        SQLQuery query = builder.buildDataQuery(params, schema);

        assertEquals("SELECT \"timestamp\" AS time, \"value\" AS value, \"collector_id\" AS collector_id,"
            + " \"gateway_id\" AS gateway_id, \"equipment_id\" AS equipment_id, \"tag_id\" AS tag_id"
            + " FROM \"public\".\"readings\""
            + " WHERE \"timestamp\" BETWEEN ? AND ?"
            + " AND (CAST(\"collector_id\" AS TEXT) = ?)"
            + " AND (CAST(\"tag_id\" AS TEXT) IN (?, ?, ?))"
            + " ORDER BY \"timestamp\" DESC LIMIT ?", query.getSql());
        assertEquals(List.of(Timestamp.from(START), Timestamp.from(END), "1", "10", "20", "30", 500),
            query.getParameters());
    }

    @Test
    public void testCustomColumnsAreQuoted() {
        ColumnMapping mapping = new ColumnMapping();
        mapping.setTimeColumn("data_hora");
        mapping.setValueColumn("val\"ue");
        mapping.setLevelColumn(HierarchyLevel.TAG, "TagId");
        SQLQuery query = builder.buildDataQuery(QueryParams.builder().startTime(START).endTime(END).limit(null).build(),
            new TableSchema(null, "dados", mapping));

        assertTrue(query.getSql().contains("\"data_hora\" AS time"));
        assertTrue(query.getSql().contains("\"val\"\"ue\" AS value"));
        assertTrue(query.getSql().contains("\"TagId\" AS tag_id"));
        assertTrue(query.getSql().contains("FROM \"public\".\"dados\""));
        assertFalse(query.getSql().contains("LIMIT"));
        assertEquals(2, query.getParameters().size());
    }

    @Test
    public void testAggregatedQuery() {
        QueryParams params = QueryParams.builder().startTime(START).endTime(END).build();
        SQLQuery query = builder.buildAggregatedQuery(params, schema, AggregationType.LAST, "15m");

        assertTrue(query.getSql().startsWith("SELECT time_bucket(CAST(? AS INTERVAL), \"timestamp\") AS time,"
            + " last(\"value\", \"timestamp\") AS value"));
        assertTrue(query.getSql().endsWith(" GROUP BY 1, 3, 4, 5, 6 ORDER BY 1 DESC"));
        assertEquals("15 minutes", query.getParameters().get(0));
    }

    @Test
    public void testIntervalLiterals() {
        assertEquals("5 minutes", SQLQueryBuilder.toIntervalLiteral("5m"));
        assertEquals("1 minute", SQLQueryBuilder.toIntervalLiteral("1m"));
        assertEquals("1 hour", SQLQueryBuilder.toIntervalLiteral("1h"));
        assertEquals("2 days", SQLQueryBuilder.toIntervalLiteral("2d"));
        assertEquals("30 seconds", SQLQueryBuilder.toIntervalLiteral("30s"));
        assertEquals("7 minutes", SQLQueryBuilder.toIntervalLiteral("7x"));
        assertEquals("1 minute", SQLQueryBuilder.toIntervalLiteral(""));
        assertEquals("1 minute", SQLQueryBuilder.toIntervalLiteral("abc"));
        assertEquals("1 minute", SQLQueryBuilder.toIntervalLiteral(null));
    }

    @Test
    public void testInvalidInput() {
        QueryParams inverted = QueryParams.builder().startTime(END).endTime(START).build();
        assertThrows(IllegalArgumentException.class, () -> builder.buildDataQuery(inverted, schema));
        QueryParams valid = QueryParams.builder().startTime(START).endTime(END).build();
        assertThrows(NullPointerException.class, () -> builder.buildDataQuery(valid, null));
        assertThrows(IllegalArgumentException.class, () -> builder.buildDataQuery(valid, new TableSchema()));
    }

    @Test
    public void testIntrospectionQueriesAreBound() {
        assertEquals(List.of("pg_catalog", "information_schema", "pg_toast"), builder.buildSchemasQuery().getParameters());
        assertEquals(List.of("public"), builder.buildTablesQuery(null).getParameters());
        assertEquals(List.of("iot", "readings"), builder.buildColumnsQuery("readings", "iot").getParameters());
        assertEquals("SELECT version()", builder.buildTestQuery());
    }
}
