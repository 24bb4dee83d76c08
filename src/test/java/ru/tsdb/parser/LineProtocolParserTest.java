package ru.tsdb.parser;

import org.junit.Test;
import ru.tsdb.errors.ErrorType;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.point.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Unit tests for {@link LineProtocolParser}
 */
public class LineProtocolParserTest {

    private final LineProtocolParser parser = new LineProtocolParser();

    @Test
    public void tagsAndFields() throws Exception {
        final List<Point> points = parser.parse(
                "cpu,host=server01,region=us-west usage_idle=90.5,usage_user=10.1 1609459200000000000");

        assertEquals(1, points.size());
        final Point point = points.get(0);
        assertEquals("cpu", point.getMeasurement());

        final Map<String, String> tags = new LinkedHashMap<>();
        tags.put("host", "server01");
        tags.put("region", "us-west");
        assertEquals(tags, point.getTags());

        final Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("usage_idle", 90.5);
        fields.put("usage_user", 10.1);
        assertEquals(fields, point.getFields());
        assertEquals(1609459200000000000L, point.getTimestamp());
    }

    @Test
    public void singleValue() throws Exception {
        final List<Point> points = parser.parse("cpu,host=server01,region=us-west value=0.64 1434055562000000000");
        assertEquals(1, points.size());
        final Point point = points.get(0);
        assertEquals("cpu", point.getMeasurement());
        assertEquals("server01", point.getTags().get("host"));
        assertEquals("us-west", point.getTags().get("region"));
        assertEquals(Collections.singletonMap("value", 0.64), point.getFields());
        assertEquals(1434055562000000000L, point.getTimestamp());
    }

    @Test
    public void unicode() throws Exception {
        final Point point = parser.parse("температура,город=Москва значение=-12.5 1").get(0);
        assertEquals("температура", point.getMeasurement());
        assertEquals("Москва", point.getTags().get("город"));
        assertEquals(-12.5, point.getFields().get("значение"), 0.0);
    }

    @Test
    public void noTags() throws Exception {
        final Point point = parser.parse("temperature value=21.5 1").get(0);
        assertTrue(point.getTags().isEmpty());
        assertEquals(21.5, point.getFields().get("value"), 0.0);
    }

    @Test
    public void integerSuffix() throws Exception {
        final Point point = parser.parse("disk used=42i 1609459200000000000").get(0);
        assertEquals(42.0, point.getFields().get("used"), 0.0);
    }

    @Test
    public void multipleLines() throws Exception {
        final List<Point> points = parser.parse(
                "cpu value=1 1\n\n   \nmem value=2 2\r\ndisk value=3 3\n");
        assertEquals(3, points.size());
        assertEquals("cpu", points.get(0).getMeasurement());
        assertEquals("mem", points.get(1).getMeasurement());
        assertEquals("disk", points.get(2).getMeasurement());
    }

    @Test
    public void blankInput() throws Exception {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("\n  \n\t\n").isEmpty());
    }

    @Test
    public void tagValueWithEquals() throws Exception {
        final Point point = parser.parse("cpu,expr=a=b value=1 1").get(0);
        assertEquals("a=b", point.getTags().get("expr"));
    }

    @Test
    public void specialValues() throws Exception {
        final Point point = parser.parse("m a=-1.5e3,b=inf,c=-Infinity,d=NaN,e=.5,f=+7 -5").get(0);
        assertEquals(-1500.0, point.getFields().get("a"), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, point.getFields().get("b"), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, point.getFields().get("c"), 0.0);
        assertTrue(Double.isNaN(point.getFields().get("d")));
        assertEquals(0.5, point.getFields().get("e"), 0.0);
        assertEquals(7.0, point.getFields().get("f"), 0.0);
        assertEquals(-5L, point.getTimestamp());
    }

    @Test
    public void invalidFieldValue() {
        final TSDBException e = parseFailure("cpu value=abc 1609459200000000000");
        assertEquals("invalid field value 'abc'", e.getReason());
        assertTrue(e.getMessage().startsWith("invalid field value 'abc'"));
        assertTrue(e.getCause() instanceof NumberFormatException);
        assertEquals(1, e.getContext().get("line"));
    }

    @Test
    public void javaOnlyNumberSyntaxIsRejected() {
        assertEquals("invalid field value '1.5f'", parseFailure("cpu value=1.5f 1").getReason());
        assertEquals("invalid field value '0x10'", parseFailure("cpu value=0x10 1").getReason());
        assertEquals("invalid field value ''", parseFailure("cpu value= 1").getReason());
    }

    @Test
    public void overflowingValue() {
        assertEquals("invalid field value '1e400'", parseFailure("cpu value=1e400 1").getReason());
    }

    @Test
    public void wrongPartCount() {
        assertEquals("invalid line format: expected 3 parts, got 2",
                parseFailure("cpu value=1").getMessage());
        assertEquals("invalid line format: expected 3 parts, got 4",
                parseFailure("cpu value=1 1 extra").getMessage());
    }

    @Test
    public void missingMeasurement() {
        assertEquals("missing measurement name", parseFailure(",host=a value=1 1").getMessage());
    }

    @Test
    public void malformedTag() {
        assertEquals("malformed tag: host", parseFailure("cpu,host value=1 1").getMessage());
        assertEquals("invalid tag key or value: host=", parseFailure("cpu,host= value=1 1").getMessage());
        assertEquals("invalid tag key or value: =a", parseFailure("cpu,=a value=1 1").getMessage());
    }

    @Test
    public void malformedField() {
        assertEquals("malformed field: value", parseFailure("cpu value 1").getMessage());
        assertEquals("malformed field: ", parseFailure("cpu a=1, 1").getMessage());
        assertEquals("empty field name", parseFailure("cpu =1 1").getMessage());
    }

    @Test
    public void invalidTimestamp() {
        final TSDBException e = parseFailure("cpu value=1 yesterday");
        assertEquals("invalid timestamp", e.getReason());
        assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    public void wholeInputRejected() {
        final TSDBException e = parseFailure("cpu value=1 1\nmem value=oops 2\ndisk value=3 3");
        assertEquals(2, e.getContext().get("line"));
        assertEquals("invalid field value 'oops'", e.getReason());
    }

    @Test
    public void lineProtocolRoundTrip() throws Exception {
        final String line = "cpu,host=a,dc=eu idle=90.5,user=10,steal=-0.25 1609459200000000001";
        final Point point = parser.parse(line).get(0);
        assertEquals(line, point.toLineProtocol());
        assertEquals(point, parser.parse(point.toLineProtocol()).get(0));
    }

    private TSDBException parseFailure(final String input) {
        try {
            parser.parse(input);
        } catch (TSDBException e) {
            assertEquals(ErrorType.VALIDATION, e.getType());
            return e;
        }
        fail("Expected a validation error for: " + input);
        return null;
    }
}
