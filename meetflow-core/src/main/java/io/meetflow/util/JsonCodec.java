package io.meetflow.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON encoding used at the persistence boundary and for reading platform payloads.
 *
 * @see #getDefault()
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the shared Jackson-backed instance.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON. Returns {@code null} for a {@code null} value.
     */
    String toJson(Object value);

    /**
     * Decodes a JSON array into a typed list. Returns an empty list for {@code null} or blank input.
     *
     * @throws IllegalArgumentException if the input is not a JSON array of {@code type}
     */
    <T> List<T> parseList(String json, Class<T> type);

    /**
     * Parses JSON into a tree.
     *
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    JsonNode readTree(String json);
}
