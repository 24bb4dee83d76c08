package ru.tsdb.point;

import org.junit.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class PointTest {

    @Test(expected = IllegalArgumentException.class)
    public void emptyMeasurement() {
        new Point("", Collections.emptyMap(), Collections.singletonMap("v", 1.0), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void noFields() {
        new Point("cpu", Collections.emptyMap(), Collections.emptyMap(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyTagValue() {
        new Point("cpu", Collections.singletonMap("host", ""), Collections.singletonMap("v", 1.0), 0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void immutableFields() {
        final Point point = new Point("cpu", Collections.emptyMap(), new LinkedHashMap<>(fields()), 0);
        point.getFields().put("other", 2.0);
    }

    @Test
    public void defensiveCopy() {
        final Map<String, Double> fields = new LinkedHashMap<>(fields());
        final Point point = new Point("cpu", Collections.emptyMap(), fields, 0);
        fields.put("other", 2.0);
        assertEquals(2, point.getFields().size());
    }

    @Test
    public void equalityIgnoresOrder() {
        final Map<String, Double> reversed = new LinkedHashMap<>();
        reversed.put("b", 2.0);
        reversed.put("a", 1.0);
        final Point first = new Point("cpu", Collections.emptyMap(), fields(), 7);
        final Point second = new Point("cpu", Collections.emptyMap(), reversed, 7);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, new Point("cpu", Collections.emptyMap(), fields(), 8));
    }

    @Test
    public void instant() {
        assertEquals(Instant.parse("2021-01-01T00:00:00.000000001Z"),
                point(1609459200000000001L).getInstant());
        assertEquals(Instant.parse("1969-12-31T23:59:59.999999999Z"), point(-1).getInstant());
    }

    @Test
    public void formatValue() {
        assertEquals("90.5", Point.formatValue(90.5));
        assertEquals("10", Point.formatValue(10.0));
        assertEquals("1500", Point.formatValue(1.5e3));
        assertEquals("0.000001", Point.formatValue(1e-6));
        assertEquals("1000000000000000000000", Point.formatValue(1e21));
        assertEquals("0.64", Point.formatValue(0.64));
        assertEquals("-12.5", Point.formatValue(-12.5));
        assertEquals("0", Point.formatValue(0.0));
        assertEquals("-0", Point.formatValue(-0.0));
        assertEquals("NaN", Point.formatValue(Double.NaN));
        assertEquals("+Inf", Point.formatValue(Double.POSITIVE_INFINITY));
        assertEquals("-Inf", Point.formatValue(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void formatValueUsesShortestDigits() {
        assertEquals("100000000000000000000000", Point.formatValue(1e23));
        assertEquals("282879384806159000", Point.formatValue(2.82879384806159E17));
        assertEquals("0.30000000000000004", Point.formatValue(0.1 + 0.2));
    }

    @Test
    public void lineProtocol() {
        final Point point = new Point("cpu", Collections.singletonMap("host", "a"), fields(), 42);
        assertEquals("cpu,host=a a=1,b=2 42", point.toLineProtocol());
    }

    private static Map<String, Double> fields() {
        final Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("a", 1.0);
        fields.put("b", 2.0);
        return fields;
    }

    private static Point point(final long timestamp) {
        return new Point("cpu", Collections.emptyMap(), fields(), timestamp);
    }
}
