package com.ai.bookingbot.entity.converter;

import com.ai.bookingbot.conversation.SelectionMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the numbered options of the last prompt as JSON so they survive restarts.
 */
@Converter
public class SelectionMappingConverter implements AttributeConverter<SelectionMapping, String> {

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public String convertToDatabaseColumn(SelectionMapping attribute) {
        if (attribute == null) return null;
        try {
            return mapper.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize selection mapping", e);
        }
    }

    @Override
    public SelectionMapping convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return null;
        try {
            return mapper.readValue(dbData, SelectionMapping.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read selection mapping", e);
        }
    }
}
