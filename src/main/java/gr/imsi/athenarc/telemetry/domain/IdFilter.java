package gr.imsi.athenarc.telemetry.domain;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.List;

/**
 * Helpers for the comma-separated ID lists used as hierarchy filters.
 */
public final class IdFilter {

    private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private IdFilter() {}

    /**
     * Splits {@code "10, 20,30"} into {@code [10, 20, 30]}. A null, empty or blank filter yields an
     * empty list, meaning no restriction.
     */
    public static List<String> split(String filter) {
        if (Strings.isNullOrEmpty(filter) || filter.isBlank()) {
            return List.of();
        }
        return COMMA_SPLITTER.splitToList(filter);
    }

    public static boolean isUnrestricted(String filter) {
        return split(filter).isEmpty();
    }
}
