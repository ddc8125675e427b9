package com.openforge.lexguard.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.Map;

/**
 * JSON ↔ TEXT column mappers for the structured columns
 * (classifier categories and scores, suspension evidence ids, audit details).
 *
 * Null maps to SQL NULL both ways. Malformed JSON in the database is a data
 * corruption, not something to paper over, so it is rethrown.
 */
public final class JsonConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private JsonConverters() {
    }

    abstract static class JsonConverter<T> implements AttributeConverter<T, String> {

        private final TypeReference<T> type;

        JsonConverter(TypeReference<T> type) {
            this.type = type;
        }

        @Override
        public String convertToDatabaseColumn(T attribute) {
            if (attribute == null) return null;
            try {
                return MAPPER.writeValueAsString(attribute);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot serialize column value", e);
            }
        }

        @Override
        public T convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isBlank()) return null;
            try {
                return MAPPER.readValue(dbData, type);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt JSON column: " + e.getOriginalMessage(), e);
            }
        }
    }

    @Converter
    public static class BooleanMapConverter extends JsonConverter<Map<String, Boolean>> {
        public BooleanMapConverter() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class DoubleMapConverter extends JsonConverter<Map<String, Double>> {
        public DoubleMapConverter() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class LongListConverter extends JsonConverter<List<Long>> {
        public LongListConverter() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class ObjectMapConverter extends JsonConverter<Map<String, Object>> {
        public ObjectMapConverter() {
            super(new TypeReference<>() {});
        }
    }
}
