package gr.imsi.athenarc.telemetry.domain;


/** Aggregate functions a backend can compute over a time window **/
public enum AggregationType {
    MEAN("mean"),
    MIN("min"),
    MAX("max"),
    COUNT("count"),
    SUM("sum"),
    STDDEV("stddev"),
    FIRST("first"),
    LAST("last");

    private final String fluxFunction;

    AggregationType(String fluxFunction) {
        this.fluxFunction = fluxFunction;
    }

    /** Name of the matching Flux function, e.g. {@code mean} for {@link #MEAN}. */
    public String fluxFunction() {
        return fluxFunction;
    }
}
