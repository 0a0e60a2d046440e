package com.unifiedinbox.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

@Converter
@Slf4j
public class SyncCursorConverter implements AttributeConverter<SyncCursor, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(SyncCursor cursor) {
        if (cursor == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(cursor);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize sync cursor", e);
        }
    }

    /**
     * An unreadable cursor maps to {@code null}, which makes the next sync a full fetch.
     */
    @Override
    public SyncCursor convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, SyncCursor.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable sync cursor: {}", e.getOriginalMessage());
            return null;
        }
    }
}
