package com.jay.tradeledger.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.jay.tradeledger.model.OrderMetadata;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores the tagged metadata variant; the entry_type discriminator travels inside the JSON. */
@Converter
public class OrderMetadataConverter implements AttributeConverter<OrderMetadata, String> {

    @Override
    public String convertToDatabaseColumn(OrderMetadata attribute) {
        if (attribute == null) return null;
        attribute.validate();
        try {
            return LedgerJson.MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Order metadata is not serialisable: " + e.getMessage(), e);
        }
    }

    @Override
    public OrderMetadata convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return null;
        try {
            return LedgerJson.MAPPER.readValue(dbData, OrderMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt order metadata column: " + e.getMessage(), e);
        }
    }
}
