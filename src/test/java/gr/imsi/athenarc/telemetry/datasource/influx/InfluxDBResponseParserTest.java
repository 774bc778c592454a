package gr.imsi.athenarc.telemetry.datasource.influx;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.telemetry.domain.DataPoint;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InfluxDBResponseParserTest {

    private final InfluxDBResponseParser parser = new InfluxDBResponseParser();

    @Test
    public void testSingleAnnotatedTable() {
        String csv = "#datatype,string,long,dateTime:RFC3339,double,string,string,string,string\r\n"
            + ",result,table,_time,_value,collector_id,gateway_id,equipment_id,tag_id\r\n"
            + ",_result,0,2024-01-01T10:00:00Z,12.5,1,2,3,4\r\n"
            + ",_result,0,2024-01-01T09:55:00Z,11,1,2,3,5\r\n"
            + "\r\n";
        List<DataPoint> points = parser.parse(csv);

        assertEquals(2, points.size());
        DataPoint first = points.get(0);
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), first.getTime());
        assertEquals("1", first.getCollectorId());
        assertEquals("2", first.getGatewayId());
        assertEquals("3", first.getEquipmentId());
        assertEquals("4", first.getTagId());
        assertEquals("12.5", first.getValue());
        assertEquals("5", points.get(1).getTagId());
    }

    @Test
    public void testHeaderWithoutAnnotation() {
        String csv = ",result,table,_time,_value,tag_id\n,_result,0,2024-01-01T10:00:00Z,1,9\n";
        List<DataPoint> points = parser.parse(csv);
        assertEquals(1, points.size());
        assertEquals("9", points.get(0).getTagId());
        assertEquals("", points.get(0).getCollectorId());
    }

    @Test
    public void testSecondTableWithReorderedColumns() {
        String csv = "#datatype,string,long,dateTime:RFC3339,double,string,string,string,string\n"
            + ",result,table,_time,_value,collector_id,gateway_id,equipment_id,tag_id\n"
            + ",_result,0,2024-01-01T10:00:00Z,1.0,c1,g1,e1,t1\n"
            + "\n"
            + "#datatype,string,long,string,double,dateTime:RFC3339,string,string,string\n"
            + ",result,table,tag_id,_value,_time,equipment_id,gateway_id,collector_id\n"
            + ",_result,1,t2,2.0,2024-01-01T11:00:00Z,e2,g2,c2\n";
        List<DataPoint> points = parser.parse(csv);

        assertEquals(2, points.size());
        DataPoint second = points.get(1);
        assertEquals(Instant.parse("2024-01-01T11:00:00Z"), second.getTime());
        assertEquals("c2", second.getCollectorId());
        assertEquals("g2", second.getGatewayId());
        assertEquals("e2", second.getEquipmentId());
        assertEquals("t2", second.getTagId());
        assertEquals("2.0", second.getValue());
    }

    @Test
    public void testQuotesAreStripped() {
        String csv = ",result,table,_time,_value,collector_id,tag_id\n"
            + ",_result,0,\"2024-01-01T10:00:00Z\",\"3.5\",\"abc\", \"x\n";
        DataPoint point = parser.parse(csv).get(0);
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), point.getTime());
        assertEquals("3.5", point.getValue());
        assertEquals("abc", point.getCollectorId());
        assertEquals("x", point.getTagId());
    }

    @Test
    public void testQuotedCommaStaysInsideCell() {
        String csv = ",result,table,_time,tag_id,_value\n"
            + ",_result,0,2024-01-01T10:00:00Z,\"Line 2, Pump A\",42.5\n";
        List<DataPoint> points = parser.parse(csv);
        assertEquals(1, points.size());
        assertEquals("Line 2, Pump A", points.get(0).getTagId());
        assertEquals("42.5", points.get(0).getValue());
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), points.get(0).getTime());
    }

    @Test
    public void testDistinctValuesKeepQuotedCommas() {
        String csv = ",result,table,_value\n"
            + ",_result,0,\"a,b\"\n"
            + ",_result,0,c\n";
        assertEquals(List.of("a,b", "c"), parser.parseDistinctValues(csv, "_value"));
    }

    @Test
    public void testIdsAreNeverValidated() {
        String csv = ",result,table,_time,_value,collector_id,gateway_id,equipment_id,tag_id\n"
            + ",_result,0,2024-01-01T10:00:00Z,1,north-plant,avg_value,average_60m,PT-101\n";
        DataPoint point = parser.parse(csv).get(0);
        assertEquals("north-plant", point.getCollectorId());
        assertEquals("avg_value", point.getGatewayId());
        assertEquals("average_60m", point.getEquipmentId());
        assertEquals("PT-101", point.getTagId());
    }

    @Test
    public void testShortRowsAndBadTimesAreDefaulted() {
        String csv = ",result,table,_time,_value,collector_id,gateway_id,equipment_id,tag_id\n"
            + ",_result,0,not-a-time,5\n";
        Instant before = Instant.now();
        List<DataPoint> points = parser.parse(csv);
        assertEquals(1, points.size());
        assertFalse(points.get(0).getTime().isBefore(before));
        assertEquals("5", points.get(0).getValue());
        assertEquals("", points.get(0).getTagId());
    }

    @Test
    public void testEmptyInput() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("  \r\n \n").isEmpty());
        assertTrue(parser.parse(",result,table,_time,_value\n").isEmpty());
    }

    @Test
    public void testDistinctValues() {
        String csv = "#datatype,string,long,string\n"
            + ",result,table,_value\n"
            + ",_result,0,7\n"
            + ",_result,0,3\n"
            + ",_result,0,7\n"
            + ",_result,0,\n";
        assertEquals(List.of("7", "3"), parser.parseDistinctValues(csv, "_value"));
        assertTrue(parser.parseDistinctValues(csv, "tag_id").isEmpty());
    }

    @Test
    public void testCleanCsvValue() {
        assertEquals("a", InfluxDBResponseParser.cleanCsvValue(" \"a\" "));
        assertEquals("a", InfluxDBResponseParser.cleanCsvValue("\"a"));
        assertEquals("", InfluxDBResponseParser.cleanCsvValue(null));
        assertEquals("\"", InfluxDBResponseParser.cleanCsvValue("\"\"\""));
    }
}
