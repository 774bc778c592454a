package gr.imsi.athenarc.telemetry.datasource;

import java.util.List;
import java.util.Map;

import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;

/**
 * Capability of data sources that can list the IDs present at a hierarchy level.
 */
public interface SupportsHierarchyDiscovery {

    /**
     * @param level the level to list
     * @param parentIds exact IDs of enclosing levels to restrict the listing to, may be empty
     * @return the distinct IDs found, or an empty list if discovery failed
     */
    List<String> getAvailableIds(HierarchyLevel level, Map<HierarchyLevel, String> parentIds);
}
