package io.meetflow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Instants are written as ISO-8601 strings and unknown properties are ignored on read.
 */
public final class JacksonJsonCodec implements JsonCodec {
    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

    private final ObjectMapper mapper;

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> List<T> parseList(String json, Class<T> type) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return List.of();
        }
        CollectionType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            return mapper.readValue(json, listType);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Expected JSON array of " + type.getSimpleName(), e);
        }
    }

    @Override
    public JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("JSON input is empty");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }
}
