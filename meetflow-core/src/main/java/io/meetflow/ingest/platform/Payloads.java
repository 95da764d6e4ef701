package io.meetflow.ingest.platform;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Null-tolerant accessors for webhook JSON.
 */
final class Payloads {

    private Payloads() {
    }

    /**
     * Returns the text at {@code field}, or {@code null} if missing, null, or blank.
     */
    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static String requireText(JsonNode node, String field, String context) {
        String value = text(node, field);
        if (value == null) {
            throw new IllegalArgumentException(context + " is missing '" + field + "'");
        }
        return value;
    }

    /**
     * Parses an ISO-8601 instant, returning {@code null} for missing or unparseable values.
     */
    static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
