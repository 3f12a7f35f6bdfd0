package me.matthew.flink.csmoneyscraper.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Timestamp conversions for cs.money payloads.
 */
public class TimestampUtil {

    /**
     * Converts a cs.money trade lock value (milliseconds since epoch) to an instant.
     * @param timestampMs milliseconds since epoch, may be null
     * @return the instant, or null when the value is null or 0 (not locked)
     */
    public static Instant fromCsmoneyMillis(Long timestampMs) {
        if (timestampMs == null || timestampMs == 0L) {
            return null;
        }
        return Instant.ofEpochMilli(timestampMs);
    }

    /**
     * Reads an optional millisecond timestamp field.
     * @param node JSON field value, may be null or JSON null
     * @return the instant, or null when absent or 0
     * @throws IllegalArgumentException if the value is present but not an integral number
     */
    public static Instant fromCsmoneyMillis(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber() || !node.canConvertToExactIntegral()) {
            throw new IllegalArgumentException("Expected an integer millisecond timestamp, got: " + node);
        }
        return fromCsmoneyMillis(node.longValue());
    }
}
