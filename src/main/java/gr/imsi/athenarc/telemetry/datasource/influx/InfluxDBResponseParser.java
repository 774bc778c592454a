package gr.imsi.athenarc.telemetry.datasource.influx;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DateTimeUtil;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads data points out of an InfluxDB annotated CSV response.
 * <p>
 * A response may hold several result tables one after the other, each starting with its own
 * header row. Column positions are therefore re-resolved whenever a new header row shows up.
 * Rows that cannot be read are skipped or defaulted field by field, so a malformed response
 * yields fewer points rather than an error. Cells are split with univocity's CSV parser so quoted
 * values may contain commas. Instances hold no state and can be shared.
 */
public class InfluxDBResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBResponseParser.class);

    public static final String TIME_COLUMN = "_time";
    public static final String VALUE_COLUMN = "_value";
    private static final String ANNOTATION_PREFIX = "#";

    private static final Splitter LINE_SPLITTER = Splitter.on(CharMatcher.anyOf("\r\n")).omitEmptyStrings();

    public List<DataPoint> parse(String csvResponse) {
        List<DataPoint> dataPoints = new ArrayList<>();
        if (Strings.isNullOrEmpty(csvResponse)) {
            return dataPoints;
        }
        try {
            List<String> lines = splitLines(csvResponse);
            if (lines.size() < 2) {
                LOG.debug("Response has no data rows");
                return dataPoints;
            }

            int headerLine = firstNonAnnotationLine(lines);
            if (headerLine < 0) {
                return dataPoints;
            }
            CsvParser csvParser = newLineParser();
            HeaderIndex header = HeaderIndex.of(splitCells(csvParser, lines.get(headerLine)));

            for (int i = headerLine + 1; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.startsWith(ANNOTATION_PREFIX)) {
                    continue;
                }
                String[] cells = splitCells(csvParser, line);
                if (isHeader(cells)) {
                    header = HeaderIndex.of(cells);
                    LOG.debug("New result table at line {}", i);
                    continue;
                }
                dataPoints.add(header.toDataPoint(cells));
            }
        } catch (RuntimeException e) {
            LOG.error("Error parsing InfluxDB response, keeping the {} points read so far", dataPoints.size(), e);
        }
        LOG.debug("Parsed {} data points", dataPoints.size());
        return dataPoints;
    }

    /**
     * Distinct non-empty values of one column of a single-table response, in order of first
     * appearance.
     */
    public List<String> parseDistinctValues(String csvResponse, String columnName) {
        Set<String> values = new LinkedHashSet<>();
        if (Strings.isNullOrEmpty(csvResponse)) {
            return new ArrayList<>(values);
        }
        try {
            List<String> lines = splitLines(csvResponse);
            int headerLine = firstNonAnnotationLine(lines);
            if (headerLine < 0) {
                return new ArrayList<>(values);
            }
            CsvParser csvParser = newLineParser();
            int column = indexOf(splitCells(csvParser, lines.get(headerLine)), columnName);
            if (column < 0) {
                LOG.warn("Column {} not found in response header", columnName);
                return new ArrayList<>(values);
            }
            for (int i = headerLine + 1; i < lines.size(); i++) {
                if (lines.get(i).startsWith(ANNOTATION_PREFIX)) {
                    continue;
                }
                String value = cell(splitCells(csvParser, lines.get(i)), column);
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Error parsing distinct values of {}", columnName, e);
        }
        return new ArrayList<>(values);
    }

    /**
     * Strips surrounding whitespace and one layer of double quotes. An unmatched quote at
     * either end is dropped too.
     */
    static String cleanCsvValue(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        if (trimmed.length() > 1 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        if (trimmed.startsWith("\"")) {
            return trimmed.substring(1);
        }
        if (trimmed.endsWith("\"")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static List<String> splitLines(String csvResponse) {
        List<String> lines = new ArrayList<>();
        for (String line : LINE_SPLITTER.split(csvResponse)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static int firstNonAnnotationLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).startsWith(ANNOTATION_PREFIX)) {
                return i;
            }
        }
        return -1;
    }

    // CsvParser keeps per-parse state, one instance per call.
    private static CsvParser newLineParser() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(',');
        settings.getFormat().setQuote('"');
        settings.getFormat().setQuoteEscape('"');
        settings.getFormat().setComment('\0');
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(-1);
        return new CsvParser(settings);
    }

    private static String[] splitCells(CsvParser csvParser, String line) {
        String[] cells = csvParser.parseLine(line);
        return cells == null ? new String[0] : cells;
    }

    // A header row starts with an empty annotation column and names both _time and _value
    private static boolean isHeader(String[] cells) {
        if (cells.length == 0 || !cleanCsvValue(cells[0]).isEmpty()) {
            return false;
        }
        return indexOf(cells, TIME_COLUMN) >= 0 && indexOf(cells, VALUE_COLUMN) >= 0;
    }

    private static int indexOf(String[] cells, String columnName) {
        for (int i = 0; i < cells.length; i++) {
            if (cleanCsvValue(cells[i]).equalsIgnoreCase(columnName)) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(String[] cells, int index) {
        if (index < 0 || index >= cells.length) {
            return "";
        }
        return cleanCsvValue(cells[index]);
    }

    /**
     * Column positions of the table currently being read.
     */
    private static final class HeaderIndex {
        private final int time;
        private final int value;
        private final Map<HierarchyLevel, Integer> levels;

        private HeaderIndex(int time, int value, Map<HierarchyLevel, Integer> levels) {
            this.time = time;
            this.value = value;
            this.levels = levels;
        }

        static HeaderIndex of(String[] headerCells) {
            Map<HierarchyLevel, Integer> levels = new EnumMap<>(HierarchyLevel.class);
            for (HierarchyLevel level : HierarchyLevel.values()) {
                levels.put(level, indexOf(headerCells, level.getDefaultColumn()));
            }
            return new HeaderIndex(indexOf(headerCells, TIME_COLUMN), indexOf(headerCells, VALUE_COLUMN), levels);
        }

        DataPoint toDataPoint(String[] cells) {
            String timeText = cell(cells, time);
            Instant timestamp = timeText.isEmpty() ? Instant.now() : DateTimeUtil.parseInstantOrNow(timeText);
            return new DataPoint(
                timestamp,
                cell(cells, levels.get(HierarchyLevel.COLLECTOR)),
                cell(cells, levels.get(HierarchyLevel.GATEWAY)),
                cell(cells, levels.get(HierarchyLevel.EQUIPMENT)),
                cell(cells, levels.get(HierarchyLevel.TAG)),
                cell(cells, value));
        }
    }
}
