package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code GET /api/tags/{connectionId}}.
 */
public class TagsResponse {

    @JsonProperty("connection_id")
    private int connectionId;

    @JsonProperty("connection_name")
    private String connectionName;

    @JsonProperty("connection_type")
    private String connectionType;

    @JsonProperty("tags")
    private List<ApiTag> tags;

    @JsonProperty("count")
    private int count;

    public int getConnectionId() { return connectionId; }
    public String getConnectionName() { return connectionName; }
    public String getConnectionType() { return connectionType; }
    public List<ApiTag> getTags() { return tags; }
    public int getCount() { return count; }
}
