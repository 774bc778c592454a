package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DateTimeUtil;

/**
 * One row of a query response.
 */
public class DataPointRecord {

    @JsonProperty("time")
    private String time;

    @JsonProperty("collector_id")
    private String collectorId;

    @JsonProperty("gateway_id")
    private String gatewayId;

    @JsonProperty("equipment_id")
    private String equipmentId;

    @JsonProperty("tag_id")
    private String tagId;

    @JsonProperty("value")
    private String value;

    public DataPointRecord() {}

    public DataPointRecord(String time, String collectorId, String gatewayId, String equipmentId, String tagId, String value) {
        this.time = time;
        this.collectorId = collectorId;
        this.gatewayId = gatewayId;
        this.equipmentId = equipmentId;
        this.tagId = tagId;
        this.value = value;
    }

    public DataPoint toDataPoint() {
        return new DataPoint(DateTimeUtil.parseInstantOrNow(time), collectorId, gatewayId, equipmentId, tagId, value);
    }

    public String getTime() { return time; }
    public String getCollectorId() { return collectorId; }
    public String getGatewayId() { return gatewayId; }
    public String getEquipmentId() { return equipmentId; }
    public String getTagId() { return tagId; }
    public String getValue() { return value; }
}
