package com.jay.tradeledger.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.jay.tradeledger.model.ReentryRecord;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ReentryListConverter implements AttributeConverter<List<ReentryRecord>, String> {

    private static final TypeReference<ArrayList<ReentryRecord>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<ReentryRecord> attribute) {
        if (attribute == null || attribute.isEmpty()) return null;
        try {
            return LedgerJson.MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Re-entries are not serialisable: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ReentryRecord> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return new ArrayList<>();
        try {
            return LedgerJson.MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt reentries column: " + e.getMessage(), e);
        }
    }
}
