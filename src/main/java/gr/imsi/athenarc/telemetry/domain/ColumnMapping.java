package gr.imsi.athenarc.telemetry.domain;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Physical column names for time, value and the four hierarchy levels of a relational table.
 */
public class ColumnMapping {

    public static final String DEFAULT_TIME_COLUMN = "timestamp";
    public static final String DEFAULT_VALUE_COLUMN = "value";

    private String timeColumn = DEFAULT_TIME_COLUMN;
    private String valueColumn = DEFAULT_VALUE_COLUMN;
    private final Map<HierarchyLevel, String> levelColumns = new EnumMap<>(HierarchyLevel.class);

    public ColumnMapping() {
        for (HierarchyLevel level : HierarchyLevel.values()) {
            levelColumns.put(level, level.getDefaultColumn());
        }
    }

    /**
     * Guesses a mapping from a table's column names. Columns that match no pattern keep their
     * default name.
     */
    public static ColumnMapping detect(List<String> columnNames) {
        ColumnMapping mapping = new ColumnMapping();
        for (String column : columnNames) {
            String lower = column.toLowerCase(Locale.ROOT);
            if (lower.contains("time") || lower.contains("date")) {
                mapping.setTimeColumn(column);
            } else if (lower.contains("valor") || lower.contains("value")) {
                mapping.setValueColumn(column);
            } else if (lower.contains("coletor") || lower.contains("collector")) {
                mapping.setLevelColumn(HierarchyLevel.COLLECTOR, column);
            } else if (lower.contains("gateway")) {
                mapping.setLevelColumn(HierarchyLevel.GATEWAY, column);
            } else if (lower.contains("equipment") || lower.contains("equipamento")) {
                mapping.setLevelColumn(HierarchyLevel.EQUIPMENT, column);
            } else if (lower.contains("tag")) {
                mapping.setLevelColumn(HierarchyLevel.TAG, column);
            }
        }
        return mapping;
    }

    public String getTimeColumn() { return timeColumn; }
    public String getValueColumn() { return valueColumn; }
    public String getLevelColumn(HierarchyLevel level) { return levelColumns.get(level); }

    public void setTimeColumn(String timeColumn) { this.timeColumn = timeColumn; }
    public void setValueColumn(String valueColumn) { this.valueColumn = valueColumn; }
    public void setLevelColumn(HierarchyLevel level, String column) { levelColumns.put(level, column); }

    @Override
    public String toString() {
        return "ColumnMapping{" +
            "time=" + timeColumn +
            ", value=" + valueColumn +
            ", levels=" + levelColumns +
            '}';
    }
}
