package ru.tsdb.parser;

import org.jetbrains.annotations.NotNull;
import ru.tsdb.errors.ErrorType;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.point.Point;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parser of the line protocol:
 * <pre>
 * measurement[,tag=value[,tag=value...]] field=value[,field=value...] timestamp
 * </pre>
 * One point per non-blank line. A field value may carry a trailing {@code i} (integer suffix),
 * the timestamp is a base-10 count of nanoseconds since the Unix epoch.
 * <p>
 * Parsing is all-or-nothing: the first invalid line fails the whole input and no points from
 * the preceding valid lines are returned. Callers that need per-line tolerance split the input
 * themselves. Instances are stateless and thread-safe.
 */
public final class LineProtocolParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NON_FINITE =
            Pattern.compile("[+-]?(inf|infinity|nan)");

    private static final String LINE = "line";

    @NotNull
    public List<Point> parse(@NotNull String input) throws TSDBException {
        final String[] lines = input.split("\n", -1);
        final List<Point> points = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            final String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                points.add(parseLine(line));
            } catch (TSDBException e) {
                throw e.withContext(LINE, i + 1);
            }
        }
        return points;
    }

    @NotNull
    private Point parseLine(@NotNull String line) throws TSDBException {
        final String[] parts = WHITESPACE.split(line);
        if (parts.length != 3) {
            throw TSDBException.validation(
                    "invalid line format: expected 3 parts, got " + parts.length);
        }

        final String[] measurementAndTags = parts[0].split(",", -1);
        final String measurement = measurementAndTags[0];
        if (measurement.isEmpty()) {
            throw TSDBException.validation("missing measurement name");
        }

        final Map<String, String> tags = new LinkedHashMap<>();
        for (int i = 1; i < measurementAndTags.length; i++) {
            final String tag = measurementAndTags[i];
            final int idx = tag.indexOf('=');
            if (idx < 0) {
                throw TSDBException.validation("malformed tag: " + tag);
            }
            final String key = tag.substring(0, idx);
            final String value = tag.substring(idx + 1);
            if (key.isEmpty() || value.isEmpty()) {
                throw TSDBException.validation("invalid tag key or value: " + tag);
            }
            tags.put(key, value);
        }

        final Map<String, Double> fields = new LinkedHashMap<>();
        for (String field : parts[1].split(",", -1)) {
            final int idx = field.indexOf('=');
            if (idx < 0) {
                throw TSDBException.validation("malformed field: " + field);
            }
            final String key = field.substring(0, idx);
            if (key.isEmpty()) {
                throw TSDBException.validation("empty field name");
            }
            final String value = field.substring(idx + 1);
            try {
                fields.put(key, parseFloat(stripIntegerSuffix(value)));
            } catch (NumberFormatException e) {
                throw TSDBException.wrap(e, ErrorType.VALIDATION,
                        "invalid field value '" + value + "'");
            }
        }

        final long timestamp;
        try {
            timestamp = Long.parseLong(parts[2]);
        } catch (NumberFormatException e) {
            throw TSDBException.wrap(e, ErrorType.VALIDATION, "invalid timestamp");
        }

        return new Point(measurement, tags, fields, timestamp);
    }

    @NotNull
    private static String stripIntegerSuffix(@NotNull String value) {
        return value.endsWith("i") ? value.substring(0, value.length() - 1) : value;
    }

    /**
     * Stricter than {@link Double#parseDouble(String)}: no surrounding whitespace, no type suffixes,
     * no hexadecimal form, and a finite literal must not overflow.
     */
    static double parseFloat(@NotNull String value) {
        final String lower = value.toLowerCase(Locale.ROOT);
        if (NON_FINITE.matcher(lower).matches()) {
            if (lower.endsWith("nan")) {
                return Double.NaN;
            }
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!DECIMAL.matcher(value).matches()) {
            throw new NumberFormatException("invalid syntax");
        }
        final double parsed = Double.parseDouble(value);
        if (Double.isInfinite(parsed)) {
            throw new NumberFormatException("value out of range");
        }
        return parsed;
    }
}
