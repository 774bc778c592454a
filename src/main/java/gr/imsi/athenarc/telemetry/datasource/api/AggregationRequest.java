package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public class AggregationRequest {

    @JsonProperty("type")
    private String type;

    @JsonProperty("window_period")
    private String windowPeriod;

    public AggregationRequest() {}

    public AggregationRequest(String type, String windowPeriod) {
        this.type = type;
        this.windowPeriod = windowPeriod;
    }

    public String getType() { return type; }
    public String getWindowPeriod() { return windowPeriod; }
}
