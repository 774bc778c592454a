package gr.imsi.athenarc.telemetry.domain;

/**
 * The four identifier levels every data point carries, outermost first.
 */
public enum HierarchyLevel {
    COLLECTOR("collector_id"),
    GATEWAY("gateway_id"),
    EQUIPMENT("equipment_id"),
    TAG("tag_id");

    private final String defaultColumn;

    HierarchyLevel(String defaultColumn) {
        this.defaultColumn = defaultColumn;
    }

    /** Column or tag name this level is stored under when no mapping says otherwise. */
    public String getDefaultColumn() {
        return defaultColumn;
    }
}
