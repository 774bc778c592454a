package gr.imsi.athenarc.telemetry.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A single telemetry reading normalized across backends.
 * <p>
 * The value is kept as text since backends return numbers in different representations.
 * Everything is fixed at construction except the aggregation annotations, which are set by
 * the aggregation strategies once a point has been produced by an aggregation path.
 */
public class DataPoint {

    private final Instant time;
    private final String collectorId;
    private final String gatewayId;
    private final String equipmentId;
    private final String tagId;
    private final String value;

    private String aggregationKind;
    private String timeWindow;

    public DataPoint() {
        this(Instant.now(), "", "", "", "", "");
    }

    public DataPoint(Instant time, String collectorId, String gatewayId, String equipmentId,
                     String tagId, String value) {
        this.time = time != null ? time : Instant.now();
        this.collectorId = nullToEmpty(collectorId);
        this.gatewayId = nullToEmpty(gatewayId);
        this.equipmentId = nullToEmpty(equipmentId);
        this.tagId = nullToEmpty(tagId);
        this.value = nullToEmpty(value);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public Instant getTime() {
        return time;
    }

    public String getCollectorId() {
        return collectorId;
    }

    public String getGatewayId() {
        return gatewayId;
    }

    public String getEquipmentId() {
        return equipmentId;
    }

    public String getTagId() {
        return tagId;
    }

    public String getValue() {
        return value;
    }

    public String getId(HierarchyLevel level) {
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

    /**
     * @return the value as a double, or empty if it is not numeric
     */
    public OptionalDouble numericValue() {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public String getAggregationKind() {
        return aggregationKind;
    }

    public String getTimeWindow() {
        return timeWindow;
    }

    public void annotate(String aggregationKind, String timeWindow) {
        this.aggregationKind = aggregationKind;
        this.timeWindow = timeWindow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataPoint that = (DataPoint) o;
        return time.equals(that.time)
            && collectorId.equals(that.collectorId)
            && gatewayId.equals(that.gatewayId)
            && equipmentId.equals(that.equipmentId)
            && tagId.equals(that.tagId)
            && value.equals(that.value)
            && Objects.equals(aggregationKind, that.aggregationKind)
            && Objects.equals(timeWindow, that.timeWindow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, collectorId, gatewayId, equipmentId, tagId, value, aggregationKind, timeWindow);
    }

    @Override
    public String toString() {
        return "{" + time +
            ", " + collectorId +
            "/" + gatewayId +
            "/" + equipmentId +
            "/" + tagId +
            ", value=" + value +
            (aggregationKind != null ? ", " + aggregationKind + "@" + timeWindow : "") +
            "}";
    }
}
