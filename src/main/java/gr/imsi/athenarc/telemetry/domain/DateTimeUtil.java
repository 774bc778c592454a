package gr.imsi.athenarc.telemetry.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;


public class DateTimeUtil {

    public static final ZoneId UTC = ZoneId.of("UTC");
    public final static String DEFAULT_FORMAT = "yyyy-MM-dd[ HH:mm:ss[.SSS]]";
    public final static DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern(DEFAULT_FORMAT);
    public final static String RFC3339_MILLIS_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";
    public final static DateTimeFormatter RFC3339_MILLIS_FORMATTER =
        DateTimeFormatter.ofPattern(RFC3339_MILLIS_FORMAT).withZone(UTC);
    private static final Logger LOG = LoggerFactory.getLogger(DateTimeUtil.class);

    // Tried in order until one accepts the text
    private static final List<Function<String, Instant>> PARSERS = List.of(
        Instant::parse,
        text -> OffsetDateTime.parse(text).toInstant(),
        text -> ZonedDateTime.parse(text).toInstant(),
        text -> LocalDateTime.parse(text).atZone(UTC).toInstant(),
        text -> LocalDateTime.parse(text, DEFAULT_FORMATTER).atZone(UTC).toInstant(),
        text -> LocalDate.parse(text, DEFAULT_FORMATTER).atStartOfDay(UTC).toInstant()
    );

    private DateTimeUtil() {}

    /**
     * Renders an instant as an RFC3339 UTC timestamp with millisecond precision,
     * e.g. {@code 2024-01-01T10:00:00.000Z}.
     */
    public static String formatRfc3339(Instant instant) {
        return RFC3339_MILLIS_FORMATTER.format(instant);
    }

    /**
     * Parses a timestamp the way a lenient generic parser would: ISO instants, offset and zoned
     * date-times, local date-times (taken as UTC), plain dates and the {@link #DEFAULT_FORMAT}.
     *
     * @return the parsed instant, or {@code null} if no format matched
     */
    public static Instant parseInstant(String s) {
        if (s == null) {
            return null;
        }
        String text = s.trim();
        if (text.isEmpty()) {
            return null;
        }
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        LOG.debug("Unparseable timestamp '{}': {}", text, lastFailure.getMessage());
        return null;
    }

    /**
     * Same as {@link #parseInstant(String)} but falls back to the current time instead of
     * returning {@code null}.
     */
    public static Instant parseInstantOrNow(String s) {
        Instant instant = parseInstant(s);
        return instant != null ? instant : Instant.now();
    }
}
