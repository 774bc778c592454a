package gr.imsi.athenarc.telemetry.aggregation;

import com.google.common.base.Preconditions;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.domain.AggregationConfiguration;
import gr.imsi.athenarc.telemetry.domain.AggregationKind;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TimeWindow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects rows from a store that already holds aggregated values.
 * <p>
 * Such a store reuses the hierarchy columns: the gateway level holds the aggregated field name
 * and the equipment level holds {@code <kind>_<window>}, e.g. {@code average_60m} or
 * {@code min_5m}. Both filters are dropped from the query, everything else is fetched in one
 * call and the rows are matched against the requested kinds and windows locally.
 */
public class LocalFilterAggregationStrategy implements AggregationStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFilterAggregationStrategy.class);

    static final HierarchyLevel METADATA_LEVEL = HierarchyLevel.EQUIPMENT;

    private final DataSource dataSource;

    public LocalFilterAggregationStrategy(DataSource dataSource) {
        this.dataSource = Preconditions.checkNotNull(dataSource, "dataSource");
    }

    @NotNull
    @Override
    public List<DataPoint> applyAggregation(QueryParams params, AggregationConfiguration config) {
        Preconditions.checkNotNull(params, "params");
        Preconditions.checkNotNull(config, "config");
        Preconditions.checkArgument(config.isValid(), "At least one aggregation kind and one time window are required");

        QueryParams storeParams = params.toBuilder()
            .gatewayId(null)
            .equipmentId(null)
            .build();

        List<DataPoint> allData;
        try {
            allData = dataSource.queryData(storeParams);
        } catch (RuntimeException e) {
            LOG.error("Error querying pre-aggregated data", e);
            throw e;
        }
        LOG.info("Retrieved {} pre-aggregated points", allData.size());

        Set<String> allowedKinds = new HashSet<>();
        for (AggregationKind kind : config.getAggregationKinds()) {
            allowedKinds.addAll(kind.storedTokens());
        }
        Set<String> allowedWindows = new HashSet<>();
        for (TimeWindow window : config.getTimeWindows()) {
            allowedWindows.add(window.toPeriod());
        }
        LOG.debug("Allowed kinds: {}, allowed windows: {}", allowedKinds, allowedWindows);

        List<DataPoint> filtered = new ArrayList<>();
        for (DataPoint point : allData) {
            String metadata = point.getId(METADATA_LEVEL);
            int separator = metadata.lastIndexOf('_');
            if (separator <= 0) {
                LOG.debug("Skipping point with invalid aggregation metadata: '{}'", metadata);
                continue;
            }
            String kind = metadata.substring(0, separator);
            String window = metadata.substring(separator + 1);
            if (allowedKinds.contains(kind) && allowedWindows.contains(window)) {
                point.annotate(kind, window);
                filtered.add(point);
            }
        }
        LOG.info("Filtering complete. {} of {} points matched", filtered.size(), allData.size());
        return filtered;
    }

    @Override
    public String getDescription() {
        return AggregationStrategyFactory.LOCAL_FILTER_DESCRIPTION;
    }
}
