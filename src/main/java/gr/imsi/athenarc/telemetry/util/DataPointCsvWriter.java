package gr.imsi.athenarc.telemetry.util;

import com.google.common.base.Strings;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DateTimeUtil;

import java.io.Writer;
import java.util.List;

/**
 * Writes data points as CSV, one row per point, aggregation columns left empty for raw points.
 * The underlying writer is flushed but not closed.
 */
public final class DataPointCsvWriter {

    static final String[] HEADERS = {"time", "collector_id", "gateway_id", "equipment_id", "tag_id", "value",
        "aggregation", "window"};

    private DataPointCsvWriter() {}

    public static void write(List<DataPoint> dataPoints, Writer writer) {
        CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
        csvWriter.writeHeaders(HEADERS);
        for (DataPoint point : dataPoints) {
            csvWriter.writeRow(
                DateTimeUtil.formatRfc3339(point.getTime()),
                point.getCollectorId(),
                point.getGatewayId(),
                point.getEquipmentId(),
                point.getTagId(),
                point.getValue(),
                Strings.nullToEmpty(point.getAggregationKind()),
                Strings.nullToEmpty(point.getTimeWindow()));
        }
        csvWriter.flush();
    }
}
