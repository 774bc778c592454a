package gr.imsi.athenarc.telemetry.domain;

import com.google.common.base.Preconditions;

import java.time.Duration;
import java.time.Instant;

/**
 * Backend-neutral description of what to fetch: one optional comma-separated ID filter per
 * hierarchy level, a time range and an optional row limit.
 * <p>
 * The ordering of {@code startTime} and {@code endTime} is not enforced here. Query builders and
 * data sources validate it, so that invalid ranges can still be expressed and rejected.
 */
public class QueryParams {

    public static final int DEFAULT_LIMIT = 1000;

    private final String collectorId;
    private final String gatewayId;
    private final String equipmentId;
    private final String tagId;
    private final Instant startTime;
    private final Instant endTime;
    private final Integer limit;

    private QueryParams(Builder builder) {
        this.collectorId = builder.collectorId;
        this.gatewayId = builder.gatewayId;
        this.equipmentId = builder.equipmentId;
        this.tagId = builder.tagId;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.limit = builder.limit;
    }

    public String getCollectorId() { return collectorId; }
    public String getGatewayId() { return gatewayId; }
    public String getEquipmentId() { return equipmentId; }
    public String getTagId() { return tagId; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Integer getLimit() { return limit; }

    public String getFilter(HierarchyLevel level) {
        switch (level) {
            case COLLECTOR:
                return collectorId;
            case GATEWAY:
                return gatewayId;
            case EQUIPMENT:
                return equipmentId;
            case TAG:
                return tagId;
            default:
                throw new IllegalArgumentException("Unknown hierarchy level: " + level);
        }
    }

    public boolean hasValidTimeRange() {
        return startTime != null && endTime != null && startTime.isBefore(endTime);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .collectorId(collectorId)
            .gatewayId(gatewayId)
            .equipmentId(equipmentId)
            .tagId(tagId)
            .startTime(startTime)
            .endTime(endTime)
            .limit(limit);
    }

    @Override
    public String toString() {
        return "QueryParams{" +
            "collectorId='" + collectorId + '\'' +
            ", gatewayId='" + gatewayId + '\'' +
            ", equipmentId='" + equipmentId + '\'' +
            ", tagId='" + tagId + '\'' +
            ", startTime=" + startTime +
            ", endTime=" + endTime +
            ", limit=" + limit +
            '}';
    }

    public static class Builder {
        private String collectorId;
        private String gatewayId;
        private String equipmentId;
        private String tagId;
        private Instant endTime = Instant.now();
        private Instant startTime = endTime.minus(Duration.ofDays(1));
        private Integer limit = DEFAULT_LIMIT;

        public Builder collectorId(String collectorId) { this.collectorId = collectorId; return this; }
        public Builder gatewayId(String gatewayId) { this.gatewayId = gatewayId; return this; }
        public Builder equipmentId(String equipmentId) { this.equipmentId = equipmentId; return this; }
        public Builder tagId(String tagId) { this.tagId = tagId; return this; }
        public Builder startTime(Instant startTime) { this.startTime = startTime; return this; }
        public Builder endTime(Instant endTime) { this.endTime = endTime; return this; }

        /** A {@code null} limit means all matching rows. */
        public Builder limit(Integer limit) { this.limit = limit; return this; }

        public Builder filter(HierarchyLevel level, String filter) {
            switch (level) {
                case COLLECTOR:
                    return collectorId(filter);
                case GATEWAY:
                    return gatewayId(filter);
                case EQUIPMENT:
                    return equipmentId(filter);
                case TAG:
                    return tagId(filter);
                default:
                    throw new IllegalArgumentException("Unknown hierarchy level: " + level);
            }
        }

        public QueryParams build() {
            Preconditions.checkArgument(limit == null || limit > 0, "limit must be positive, was %s", limit);
            return new QueryParams(this);
        }
    }
}
