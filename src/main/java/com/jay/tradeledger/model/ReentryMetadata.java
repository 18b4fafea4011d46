package com.jay.tradeledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jay.tradeledger.exception.InvalidOrderMetadataException;
import com.jay.tradeledger.model.enums.EntryType;

public record ReentryMetadata(
    @JsonProperty("level") Integer level,
    @JsonProperty("indicator_value") Double indicatorValue,
    @JsonProperty("reentry_index") Integer reentryIndex
) implements OrderMetadata {

    @Override
    public EntryType entryType() {
        return EntryType.REENTRY;
    }

    @Override
    public Double indicator() {
        return indicatorValue;
    }

    @Override
    public void validate() {
        if (level == null) {
            throw new InvalidOrderMetadataException("reentry metadata requires 'level'");
        }
        if (indicatorValue == null) {
            throw new InvalidOrderMetadataException("reentry metadata requires 'indicator_value'");
        }
        if (reentryIndex != null && reentryIndex < 1) {
            throw new InvalidOrderMetadataException("reentry_index must be >= 1, got " + reentryIndex);
        }
    }
}
