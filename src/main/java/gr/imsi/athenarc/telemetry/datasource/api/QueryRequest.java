package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Body of {@code POST /api/query}. A null ID list means no restriction on that level.
 */
public class QueryRequest {

    @JsonProperty("connection_id")
    private Integer connectionId;

    @JsonProperty("inline_credentials")
    private InlineCredentials inlineCredentials;

    @JsonProperty("measurement")
    private String measurement;

    @JsonProperty("collector_ids")
    private List<String> collectorIds;

    @JsonProperty("gateway_ids")
    private List<String> gatewayIds;

    @JsonProperty("equipment_ids")
    private List<String> equipmentIds;

    @JsonProperty("tag_ids")
    private List<String> tagIds;

    @JsonProperty("start_time")
    private Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    @JsonProperty("limit")
    private int limit;

    @JsonProperty("aggregation")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private AggregationRequest aggregation;

    public Integer getConnectionId() { return connectionId; }
    public InlineCredentials getInlineCredentials() { return inlineCredentials; }
    public String getMeasurement() { return measurement; }
    public List<String> getCollectorIds() { return collectorIds; }
    public List<String> getGatewayIds() { return gatewayIds; }
    public List<String> getEquipmentIds() { return equipmentIds; }
    public List<String> getTagIds() { return tagIds; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public int getLimit() { return limit; }
    public AggregationRequest getAggregation() { return aggregation; }

    public void setConnectionId(Integer connectionId) { this.connectionId = connectionId; }
    public void setInlineCredentials(InlineCredentials inlineCredentials) { this.inlineCredentials = inlineCredentials; }
    public void setMeasurement(String measurement) { this.measurement = measurement; }
    public void setCollectorIds(List<String> collectorIds) { this.collectorIds = collectorIds; }
    public void setGatewayIds(List<String> gatewayIds) { this.gatewayIds = gatewayIds; }
    public void setEquipmentIds(List<String> equipmentIds) { this.equipmentIds = equipmentIds; }
    public void setTagIds(List<String> tagIds) { this.tagIds = tagIds; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public void setLimit(int limit) { this.limit = limit; }
    public void setAggregation(AggregationRequest aggregation) { this.aggregation = aggregation; }
}
