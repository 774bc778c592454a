package gr.imsi.athenarc.telemetry.aggregation;

import com.google.common.base.Preconditions;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.SupportsAggregation;
import gr.imsi.athenarc.telemetry.domain.AggregationConfiguration;
import gr.imsi.athenarc.telemetry.domain.AggregationKind;
import gr.imsi.athenarc.telemetry.domain.AggregationType;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TimeWindow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Asks the backend to aggregate the raw readings, one windowed query per (kind, window) pair.
 * Composite kinds need two queries: min/max and first/last are concatenated, delta subtracts
 * the first value of a tag from its last one.
 * <p>
 * A failing pair is logged and skipped, the other pairs still run.
 */
public class PushDownAggregationStrategy implements AggregationStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(PushDownAggregationStrategy.class);

    private final SupportsAggregation aggregator;

    public PushDownAggregationStrategy(DataSource dataSource) {
        Preconditions.checkNotNull(dataSource, "dataSource");
        this.aggregator = dataSource.capability(SupportsAggregation.class)
            .orElseThrow(() -> new IllegalArgumentException("Data source " + dataSource.getDatabaseType()
                + " does not support aggregation push-down"));
    }

    @NotNull
    @Override
    public List<DataPoint> applyAggregation(QueryParams params, AggregationConfiguration config) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkNotNull(config, "config");
        Preconditions.checkArgument(config.isValid(), "At least one aggregation kind and one time window are required");

        LOG.info("Starting aggregation with {} kinds and {} windows",
            config.getAggregationKinds().size(), config.getTimeWindows().size());
        List<DataPoint> results = new ArrayList<>();
        for (AggregationKind kind : config.getAggregationKinds()) {
            for (TimeWindow window : config.getTimeWindows()) {
                String period = window.toPeriod();
                try {
                    List<DataPoint> points = aggregate(params, kind, period);
                    LOG.info("{} with {}: {} points", kind.getToken(), period, points.size());
                    results.addAll(points);
                } catch (RuntimeException e) {
                    LOG.error("Error processing {} with {}", kind.getToken(), period, e);
                }
            }
        }
        LOG.info("Completed aggregation. Total points: {}", results.size());
        return results;
    }

    private List<DataPoint> aggregate(QueryParams params, AggregationKind kind, String period) {
        switch (kind) {
            case AVERAGE:
                return tag(aggregator.queryAggregatedData(params, AggregationType.MEAN, period), kind.getToken(), period);
            case TOTAL:
                return tag(aggregator.queryAggregatedData(params, AggregationType.SUM, period), kind.getToken(), period);
            case MIN_MAX:
                return pair(params, kind, period, AggregationType.MIN, "min", AggregationType.MAX, "max");
            case FIRST_LAST:
                return pair(params, kind, period, AggregationType.FIRST, "first", AggregationType.LAST, "last");
            case DELTA:
                return delta(params, kind, period);
            default:
                throw new IllegalArgumentException("Unknown aggregation kind: " + kind);
        }
    }

    private List<DataPoint> pair(QueryParams params, AggregationKind kind, String period,
                                 AggregationType firstType, String firstSuffix,
                                 AggregationType secondType, String secondSuffix) {
        List<DataPoint> results = new ArrayList<>(
            tag(aggregator.queryAggregatedData(params, firstType, period), kind.getToken() + "_" + firstSuffix, period));
        results.addAll(
            tag(aggregator.queryAggregatedData(params, secondType, period), kind.getToken() + "_" + secondSuffix, period));
        return results;
    }

    private List<DataPoint> delta(QueryParams params, AggregationKind kind, String period) {
        List<DataPoint> firstData = aggregator.queryAggregatedData(params, AggregationType.FIRST, period);
        List<DataPoint> lastData = aggregator.queryAggregatedData(params, AggregationType.LAST, period);
        return computeDeltas(firstData, lastData, kind.getToken(), period);
    }

    /**
     * Joins both sides on tag ID and emits {@code last - first} with two decimals, using the time
     * and IDs of the last side. Only the first point seen per tag on each side takes part, which
     * is the most recent window as results come sorted newest first. Tags missing from either
     * side, or with a non-numeric value, produce nothing.
     */
    static List<DataPoint> computeDeltas(List<DataPoint> firstData, List<DataPoint> lastData,
                                         String kindToken, String period) {
        Map<String, DataPoint> firstByTag = indexByTag(firstData);
        Map<String, DataPoint> lastByTag = indexByTag(lastData);

        List<DataPoint> results = new ArrayList<>();
        for (Map.Entry<String, DataPoint> entry : firstByTag.entrySet()) {
            DataPoint last = lastByTag.get(entry.getKey());
            if (last == null) {
                continue;
            }
            OptionalDouble firstValue = entry.getValue().numericValue();
            OptionalDouble lastValue = last.numericValue();
            if (firstValue.isEmpty() || lastValue.isEmpty()) {
                continue;
            }
            double delta = lastValue.getAsDouble() - firstValue.getAsDouble();
            DataPoint point = new DataPoint(last.getTime(), last.getCollectorId(), last.getGatewayId(),
                last.getEquipmentId(), last.getTagId(), String.format(Locale.ROOT, "%.2f", delta));
            point.annotate(kindToken, period);
            results.add(point);
        }
        return results;
    }

    private static Map<String, DataPoint> indexByTag(List<DataPoint> points) {
        Map<String, DataPoint> byTag = new LinkedHashMap<>();
        for (DataPoint point : points) {
            byTag.putIfAbsent(point.getTagId(), point);
        }
        return byTag;
    }

    private static List<DataPoint> tag(List<DataPoint> points, String kindToken, String period) {
        for (DataPoint point : points) {
            point.annotate(kindToken, period);
        }
        return points;
    }

    @Override
    public String getDescription() {
        return AggregationStrategyFactory.PUSH_DOWN_DESCRIPTION;
    }
}
