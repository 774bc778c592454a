package gr.imsi.athenarc.telemetry.domain;

import java.util.Arrays;

/** Fixed window lengths aggregations are computed over. */
public enum TimeWindow {
    FIVE_MINUTES(5),
    FIFTEEN_MINUTES(15),
    THIRTY_MINUTES(30),
    SIXTY_MINUTES(60);

    private final int minutes;

    TimeWindow(int minutes) {
        this.minutes = minutes;
    }

    public int getMinutes() {
        return minutes;
    }

    /** Short period text understood by the backends, e.g. {@code 5m}. */
    public String toPeriod() {
        return minutes + "m";
    }

    public static TimeWindow fromPeriod(String period) {
        return Arrays.stream(values())
            .filter(window -> window.toPeriod().equalsIgnoreCase(period.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown time window: " + period));
    }
}
