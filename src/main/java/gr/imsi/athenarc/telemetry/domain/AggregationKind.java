package gr.imsi.athenarc.telemetry.domain;

import java.util.Arrays;
import java.util.Set;

/**
 * The aggregations a caller can ask for. Simple kinds map to a single backend aggregate function,
 * composite kinds ({@link #MIN_MAX}, {@link #FIRST_LAST}, {@link #DELTA}) need two.
 */
public enum AggregationKind {
    AVERAGE("average", "Average", Set.of("average")),
    TOTAL("total", "Total", Set.of("total")),
    MIN_MAX("min_max", "Min/Max", Set.of("min", "max")),
    FIRST_LAST("first_last", "First/Last", Set.of("first", "last")),
    DELTA("delta", "Delta", Set.of("delta"));

    private final String token;
    private final String displayName;
    private final Set<String> storedTokens;

    AggregationKind(String token, String displayName, Set<String> storedTokens) {
        this.token = token;
        this.displayName = displayName;
        this.storedTokens = storedTokens;
    }

    /** Token used to tag points produced for this kind, e.g. {@code min_max}. */
    public String getToken() {
        return token;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Tokens a pre-aggregated store writes for this kind. Composite kinds are stored as
     * separate rows, so {@link #MIN_MAX} expands to {@code min} and {@code max}.
     */
    public Set<String> storedTokens() {
        return storedTokens;
    }

    public static AggregationKind fromToken(String token) {
        return Arrays.stream(values())
            .filter(kind -> kind.token.equalsIgnoreCase(token) || kind.name().equalsIgnoreCase(token))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown aggregation kind: " + token));
    }
}
