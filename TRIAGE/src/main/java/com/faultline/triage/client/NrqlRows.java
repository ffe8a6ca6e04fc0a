package com.faultline.triage.client;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Lenient accessors for NRQL result rows, whose values arrive as loosely typed JSON.
 */
public final class NrqlRows {

    private NrqlRows() {
    }

    /**
     * Numeric value, or 0 when missing or not a number.
     */
    public static double number(Map<String, Object> row, String key) {
        Double value = optionalNumber(row, key);
        return value != null ? value : 0;
    }

    public static Double optionalNumber(Map<String, Object> row, String key) {
        Object value = row.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Map<?, ?> nested) {
            // aggregate functions such as percentage() may come back as {"result": x}
            Object inner = nested.size() == 1 ? nested.values().iterator().next() : null;
            return inner instanceof Number number ? number.doubleValue() : null;
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String text(Map<String, Object> row, String key, String fallback) {
        Object value = row.get(key);
        return value != null ? value.toString() : fallback;
    }

    /**
     * Row timestamp, falling back to the TIMESERIES bucket start.
     */
    public static Instant timestamp(Map<String, Object> row) {
        Instant timestamp = instant(row.get("timestamp"));
        if (timestamp != null) {
            return timestamp;
        }
        Object begin = row.get("beginTimeSeconds");
        if (begin instanceof Number seconds) {
            return Instant.ofEpochSecond(seconds.longValue());
        }
        return null;
    }

    /**
     * Epoch milliseconds or an ISO-8601 string.
     */
    public static Instant instant(Object value) {
        if (value instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                try {
                    return Instant.ofEpochMilli(Long.parseLong(text));
                } catch (NumberFormatException ignored) {
                    throw new TelemetryClientException("Unparseable timestamp: " + text, e);
                }
            }
        }
        return null;
    }
}
