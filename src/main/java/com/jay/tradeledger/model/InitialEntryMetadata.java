package com.jay.tradeledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jay.tradeledger.exception.InvalidOrderMetadataException;
import com.jay.tradeledger.model.enums.EntryType;

public record InitialEntryMetadata(
    @JsonProperty("indicator_level") Double indicatorLevel,
    @JsonProperty("entry_indicator") Double entryIndicator,
    @JsonProperty("initial_entry_price") Double initialEntryPrice
) implements OrderMetadata {

    @Override
    public EntryType entryType() {
        return EntryType.INITIAL;
    }

    /** Configured entry level wins over the observed reading. */
    @Override
    public Double indicator() {
        return indicatorLevel != null ? indicatorLevel : entryIndicator;
    }

    @Override
    public void validate() {
        if (initialEntryPrice != null && initialEntryPrice <= 0) {
            throw new InvalidOrderMetadataException(
                "initial_entry_price must be positive, got " + initialEntryPrice);
        }
    }
}
