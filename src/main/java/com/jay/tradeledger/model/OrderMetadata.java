package com.jay.tradeledger.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.jay.tradeledger.model.enums.EntryType;

/**
 * Semi-structured order metadata, tagged by {@code entry_type}.
 *
 * <pre>
 * {"entry_type":"initial", "indicator_level":30, "entry_indicator":28.4, "initial_entry_price":2500.0}
 * {"entry_type":"reentry", "level":20, "indicator_value":19.5, "reentry_index":1}
 * </pre>
 *
 * Every variant is validated before it is written to an order row.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "entry_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InitialEntryMetadata.class, name = "initial"),
    @JsonSubTypes.Type(value = ReentryMetadata.class, name = "reentry")
})
public interface OrderMetadata {

    EntryType entryType();

    /** Indicator reading that triggered the entry, if known. */
    Double indicator();

    /** @throws com.jay.tradeledger.exception.InvalidOrderMetadataException if the payload is incomplete */
    void validate();
}
