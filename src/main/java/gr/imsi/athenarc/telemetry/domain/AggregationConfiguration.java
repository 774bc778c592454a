package gr.imsi.athenarc.telemetry.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which aggregations to produce (kinds crossed with time windows) and for which backend.
 */
public class AggregationConfiguration {

    private final Set<AggregationKind> aggregationKinds;
    private final Set<TimeWindow> timeWindows;
    private final DatabaseType backendKind;

    public AggregationConfiguration(Collection<AggregationKind> aggregationKinds,
                                    Collection<TimeWindow> timeWindows,
                                    DatabaseType backendKind) {
        this.aggregationKinds = aggregationKinds == null || aggregationKinds.isEmpty()
            ? EnumSet.noneOf(AggregationKind.class) : EnumSet.copyOf(aggregationKinds);
        this.timeWindows = timeWindows == null || timeWindows.isEmpty()
            ? EnumSet.noneOf(TimeWindow.class) : EnumSet.copyOf(timeWindows);
        this.backendKind = backendKind;
    }

    public static AggregationConfiguration defaults(DatabaseType backendKind) {
        return new AggregationConfiguration(EnumSet.of(AggregationKind.AVERAGE),
            EnumSet.of(TimeWindow.SIXTY_MINUTES), backendKind);
    }

    public Set<AggregationKind> getAggregationKinds() {
        return Collections.unmodifiableSet(aggregationKinds);
    }

    public Set<TimeWindow> getTimeWindows() {
        return Collections.unmodifiableSet(timeWindows);
    }

    public DatabaseType getBackendKind() {
        return backendKind;
    }

    public boolean isValid() {
        return !aggregationKinds.isEmpty() && !timeWindows.isEmpty();
    }

    @Override
    public String toString() {
        return "AggregationConfiguration{" +
            "aggregationKinds=" + aggregationKinds +
            ", timeWindows=" + timeWindows +
            ", backendKind=" + backendKind +
            '}';
    }
}
