package gr.imsi.athenarc.telemetry.util;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.telemetry.domain.DataPoint;

import java.io.StringWriter;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DataPointCsvWriterTest {

    @Test
    public void testWritesHeaderAndRows() {
        DataPoint raw = new DataPoint(Instant.parse("2024-01-01T10:00:00Z"), "1", "2", "3", "4", "21.5");
        DataPoint aggregated = new DataPoint(Instant.parse("2024-01-01T11:00:00.250Z"), "1", "2", "3", "4", "4.50");
        aggregated.annotate("delta", "60m");

        StringWriter out = new StringWriter();
        DataPointCsvWriter.write(List.of(raw, aggregated), out);

        String[] lines = out.toString().split("\\r?\\n");
        assertEquals(3, lines.length);
        assertEquals("time,collector_id,gateway_id,equipment_id,tag_id,value,aggregation,window", lines[0]);
        assertEquals("2024-01-01T10:00:00.000Z,1,2,3,4,21.5,,", lines[1]);
        assertEquals("2024-01-01T11:00:00.250Z,1,2,3,4,4.50,delta,60m", lines[2]);
    }

    @Test
    public void testNoPointsWritesOnlyTheHeader() {
        StringWriter out = new StringWriter();
        DataPointCsvWriter.write(List.of(), out);
        assertTrue(out.toString().startsWith("time,collector_id"));
        assertEquals(1, out.toString().trim().split("\\r?\\n").length);
    }
}
