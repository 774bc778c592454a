package gr.imsi.athenarc.telemetry.domain;

/**
 * Location and column layout of a relational telemetry table.
 */
public class TableSchema {

    public static final String DEFAULT_SCHEMA = "public";

    private String schemaName = DEFAULT_SCHEMA;
    private String tableName;
    private ColumnMapping columnMapping = new ColumnMapping();

    public TableSchema() {}

    public TableSchema(String schemaName, String tableName, ColumnMapping columnMapping) {
        this.schemaName = schemaName == null || schemaName.isBlank() ? DEFAULT_SCHEMA : schemaName;
        this.tableName = tableName;
        this.columnMapping = columnMapping != null ? columnMapping : new ColumnMapping();
    }

    public String getSchemaName() { return schemaName; }
    public String getTableName() { return tableName; }
    public ColumnMapping getColumnMapping() { return columnMapping; }

    public void setSchemaName(String schemaName) { this.schemaName = schemaName; }
    public void setTableName(String tableName) { this.tableName = tableName; }
    public void setColumnMapping(ColumnMapping columnMapping) { this.columnMapping = columnMapping; }

    public String getFullTableName() {
        return schemaName + "." + tableName;
    }

    @Override
    public String toString() {
        return "TableSchema{" + getFullTableName() + ", " + columnMapping + '}';
    }
}
