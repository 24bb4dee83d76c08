package ru.tsdb.point;

import com.fasterxml.jackson.core.io.NumberOutput;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One measurement sample: a measurement name, string tags, numeric fields and a nanosecond timestamp.
 * <p>
 * Instances are immutable. The measurement is never empty, there is always at least one field
 * and tags never have an empty key or value. Map iteration follows insertion order, equality
 * does not depend on it.
 */
public final class Point {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    @NotNull
    private final String measurement;
    @NotNull
    private final Map<String, String> tags;
    @NotNull
    private final Map<String, Double> fields;
    private final long timestamp;

    /**
     * @param timestamp nanoseconds since the Unix epoch
     * @throws IllegalArgumentException if the point would be invalid
     */
    public Point(@NotNull String measurement,
                 @NotNull Map<String, String> tags,
                 @NotNull Map<String, Double> fields,
                 long timestamp) {
        if (measurement.isEmpty()) {
            throw new IllegalArgumentException("Measurement is empty");
        }
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Point has no fields");
        }
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (tag.getKey().isEmpty() || tag.getValue().isEmpty()) {
                throw new IllegalArgumentException("Empty tag key or value: " + tag);
            }
        }
        for (Map.Entry<String, Double> field : fields.entrySet()) {
            if (field.getKey().isEmpty()) {
                throw new IllegalArgumentException("Empty field name");
            }
            Objects.requireNonNull(field.getValue(), "field value");
        }
        this.measurement = measurement;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.timestamp = timestamp;
    }

    @NotNull
    public String getMeasurement() {
        return measurement;
    }

    @NotNull
    public Map<String, String> getTags() {
        return tags;
    }

    @NotNull
    public Map<String, Double> getFields() {
        return fields;
    }

    /**
     * @return nanoseconds since the Unix epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    @NotNull
    public Instant getInstant() {
        return Instant.ofEpochSecond(
                Math.floorDiv(timestamp, NANOS_PER_SECOND),
                Math.floorMod(timestamp, NANOS_PER_SECOND));
    }

    /**
     * Serializes the point back into a line of line protocol.
     */
    @NotNull
    public String toLineProtocol() {
        final StringBuilder sb = new StringBuilder(measurement);
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
        }
        final StringJoiner joiner = new StringJoiner(",");
        for (Map.Entry<String, Double> field : fields.entrySet()) {
            joiner.add(field.getKey() + "=" + formatValue(field.getValue()));
        }
        return sb.append(' ').append(joiner).append(' ').append(timestamp).toString();
    }

    /**
     * Shortest plain decimal form of {@code value}: no exponent and no trailing zeros.
     * <p>
     * {@link Double#toString(double)} is not guaranteed to produce the shortest digits before JDK 19,
     * so the digits come from Jackson's Schubfach writer.
     */
    @NotNull
    public static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == 0) {
            return (1 / value) < 0 ? "-0" : "0";
        }
        return new BigDecimal(NumberOutput.toString(value, true)).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        final Point point = (Point) o;
        return timestamp == point.timestamp
                && measurement.equals(point.measurement)
                && tags.equals(point.tags)
                && fields.equals(point.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags, fields, timestamp);
    }

    @Override
    public String toString() {
        return "Point{" + toLineProtocol() + "}";
    }
}
