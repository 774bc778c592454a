package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class QueryResponse {

    @JsonProperty("data")
    private List<DataPointRecord> data;

    @JsonProperty("total_count")
    private int totalCount;

    @JsonProperty("query_time_ms")
    private double queryTimeMs;

    public List<DataPointRecord> getData() { return data; }
    public int getTotalCount() { return totalCount; }
    public double getQueryTimeMs() { return queryTimeMs; }
}
