package gr.imsi.athenarc.telemetry.datasource.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ApiTag {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    public ApiTag() {}

    public ApiTag(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() { return id; }
    public String getName() { return name; }

    @Override
    public String toString() {
        return id + " (" + name + ")";
    }
}
