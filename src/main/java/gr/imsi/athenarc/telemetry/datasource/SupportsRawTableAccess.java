package gr.imsi.athenarc.telemetry.datasource;

import java.util.List;

import gr.imsi.athenarc.telemetry.domain.TableSchema;

/**
 * Capability of relational data sources to list schemas and tables and to describe a table.
 */
public interface SupportsRawTableAccess {

    List<String> getAvailableSchemas();

    /** Lists the base tables of a schema; a null or blank schema means {@code public}. */
    List<String> getTablesInSchema(String schemaName);

    /** Describes a table, guessing its column mapping from the column names. */
    TableSchema getTableSchema(String tableName, String schemaName);
}
